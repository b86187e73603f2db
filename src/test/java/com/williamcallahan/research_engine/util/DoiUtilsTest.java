package com.williamcallahan.research_engine.util;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class DoiUtilsTest {

    @ParameterizedTest
    @CsvSource({
        "https://doi.org/10.1000/ABC.123, 10.1000/abc.123",
        "http://doi.org/10.1000/abc, 10.1000/abc",
        "doi:10.48550/arXiv.1706.03762, 10.48550/arxiv.1706.03762",
        "'  10.1038/NATURE14539  ', 10.1038/nature14539"
    })
    void normalize_stripsPrefixesAndLowercases(String raw, String expected) {
        assertEquals(expected, DoiUtils.normalize(raw));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "https://doi.org/"})
    void normalize_returnsNullWhenNothingRemains(String raw) {
        assertNull(DoiUtils.normalize(raw));
    }
}
