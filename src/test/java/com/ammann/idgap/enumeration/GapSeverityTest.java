package com.ammann.idgap.enumeration;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class GapSeverityTest
{

    @ParameterizedTest
    @CsvSource({
            "1,LOW",
            "9,LOW",
            "10,MEDIUM",
            "99,MEDIUM",
            "100,HIGH",
            "250000,HIGH"
    })
    void mapsGapSizesToSeverities(long count, GapSeverity expected)
    {
        assertThat(GapSeverity.fromCount(count)).isEqualTo(expected);
    }
}
