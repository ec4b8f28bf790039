package com.astrazeneca.varfinder.resources;

import com.astrazeneca.varfinder.TestData;
import com.astrazeneca.varfinder.data.GenomeLocus;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;

public class TabularDbSnpStoreTest {

    @Test
    public void testLoad() {
        TabularDbSnpStore store = TabularDbSnpStore.load(TestData.path("/dbsnp.tsv"));

        assertEquals(store.rsIdToGenome("rs80357382"), new GenomeLocus("chr17", 41258469, 41258470));
        assertEquals(store.lookupDbSnp("chr17", 41276900, 41276901), "rs1799966");
        assertNull(store.lookupDbSnp("chr17", 41276900, 41276902));
    }

    @Test
    public void testIdentifierWithoutPrefix() {
        TabularDbSnpStore store = new TabularDbSnpStore();
        store.addSnp("chr1", 10, 11, "12345");

        assertEquals(store.lookupDbSnp("chr1", 10, 11), "rs12345");
        assertEquals(store.rsIdToGenome("12345"), store.rsIdToGenome("rs12345"));
        assertNull(store.rsIdToGenome("rs0"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testWrongIdentifier() {
        new TabularDbSnpStore().addSnp("chr1", 10, 11, "snp12");
    }
}
