package com.busreview.tracker.scrape.normalize;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RouteSplitterTest {

    @Test
    void splitsOnSupportedDelimiters() {
        assertThat(RouteSplitter.split("Chennai -> Bangalore")).isEqualTo(new RouteSplitter.Route("Chennai", "Bangalore"));
        assertThat(RouteSplitter.split("Chennai → Bangalore")).isEqualTo(new RouteSplitter.Route("Chennai", "Bangalore"));
        assertThat(RouteSplitter.split("Chennai to Bangalore")).isEqualTo(new RouteSplitter.Route("Chennai", "Bangalore"));
        assertThat(RouteSplitter.split("New Delhi - Agra")).isEqualTo(new RouteSplitter.Route("New Delhi", "Agra"));
    }

    @Test
    void missingDelimiterKeepsWholeTextAsOrigin() {
        assertThat(RouteSplitter.split("Chennai")).isEqualTo(new RouteSplitter.Route("Chennai", null));
        assertThat(RouteSplitter.split(null)).isEqualTo(new RouteSplitter.Route(null, null));
    }
}
