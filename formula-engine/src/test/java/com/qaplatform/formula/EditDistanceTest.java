package com.qaplatform.formula;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EditDistanceTest {

    @Test
    public void testDistance() {
        assertEquals(0, EditDistance.between("fluency", "fluency"));
        assertEquals(1, EditDistance.between("fluncy", "fluency"));
        assertEquals(3, EditDistance.between("kitten", "sitting"));
        assertEquals(5, EditDistance.between("", "style"));
    }

    @Test
    public void testClosestSkipsExactMatchAndRespectsLimit() {
        List<String> names = List.of("min", "max", "sum");
        assertEquals("min", EditDistance.closest("mix", names, 1));
        assertNull(EditDistance.closest("min", names, 1));
        assertEquals("max", EditDistance.closest("min", names, 2));
        assertNull(EditDistance.closest("average", names, 2));
    }
}
