package com.astrazeneca.varfinder.data;

import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;

public class AminoAcidTest {

    @Test
    public void testThreeToOne() {
        assertEquals(AminoAcid.threeToOne("ARG"), "R");
        assertEquals(AminoAcid.threeToOne("glutamic acid"), "E");
        assertNull(AminoAcid.threeToOne("Xyz"));
    }

    @Test
    public void testThreeToOneMulti() {
        assertEquals(AminoAcid.threeToOneMulti("ArgLys"), "RK");
        assertNull(AminoAcid.threeToOneMulti("ArgLy"));
        assertNull(AminoAcid.threeToOneMulti("ArgXyz"));
    }

    @Test
    public void testOneToThree() {
        assertEquals(AminoAcid.oneToThree("RG"), "ArgGly");
        assertEquals(AminoAcid.oneToThree("R?"), "ArgXaa");
    }

    @Test
    public void testFromCodon() {
        assertEquals(AminoAcid.fromCodon("aga"), AminoAcid.ARGININE);
        assertNull(AminoAcid.fromCodon("NNN"));
    }
}
