package com.essaycoach.corpus;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PromptIdsTest {

    @Test
    void testNumericIdsSortByValueBeforeText() {
        List<String> ids = new ArrayList<>(List.of("b", "10", "generic-x", "2", "1"));
        ids.sort(PromptIds.ORDER);
        assertEquals(List.of("1", "2", "10", "b", "generic-x"), ids);
    }

    @Test
    void testLeadingZerosStayDistinct() {
        assertTrue(PromptIds.compare("007", "7") < 0);
        assertEquals(0, PromptIds.compare("7", "7"));
    }
}
