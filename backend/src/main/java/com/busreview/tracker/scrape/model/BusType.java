package com.busreview.tracker.scrape.model;

public enum BusType {
    AC_SLEEPER,
    NON_AC_SLEEPER,
    AC_SEMI_SLEEPER,
    NON_AC_SEMI_SLEEPER,
    AC_SEATER,
    NON_AC_SEATER,
    OTHER
}
