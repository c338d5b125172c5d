package com.ammann.idgap.enumeration;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class StatusClassificationTest
{

    @ParameterizedTest
    @CsvSource({
            "HAS_RESULT,true,true",
            "HAS_RESULT,false,true",
            "ERROR,true,true",
            "ERROR,false,true",
            "NOT_FOUND,true,true",
            "NOT_FOUND,false,true",
            "OTHER,true,true",
            "OTHER,false,true",
            "EXCLUDED,true,true",
            "EXCLUDED,false,false",
            "EMPTY,true,false",
            "EMPTY,false,false"
    })
    void decidesWhetherStatusCountsAsPresent(StatusClassification status, boolean skipExcluded, boolean expected)
    {
        assertThat(status.countsAsPresent(skipExcluded)).isEqualTo(expected);
    }
}
