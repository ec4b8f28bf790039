package com.astrazeneca.varfinder;

import com.astrazeneca.varfinder.data.Patterns;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

public class UtilsTest {

    @Test
    public void testJoin() {
        Assert.assertEquals(Utils.join("|", Arrays.asList("a", "b", "c")), "a|b|c");
        Assert.assertEquals(Utils.join("|", Collections.emptyList()), "");
    }

    @Test
    public void testAccessionVersion() {
        Assert.assertEquals(Utils.stripVersion("NM_007294.3"), "NM_007294");
        Assert.assertEquals(Utils.stripVersion("NM_007294"), "NM_007294");
        Assert.assertEquals(Utils.getVersion("NM_007294.3"), 3);
        Assert.assertEquals(Utils.getVersion("NM_007294"), -1);
    }

    @Test
    public void testStrip() {
        Assert.assertEquals(Utils.strip(" (p.R71G); ", " ();"), "p.R71G");
        Assert.assertEquals(Utils.strip("()", "()"), "");
    }

    @Test
    public void testGlobalFind() {
        Assert.assertEquals(Utils.globalFind(Patterns.PLACEHOLDER, "{sep}{pos}[0-9]{2}"), Arrays.asList("sep", "pos", "2"));
    }

    @Test
    public void testSnippet() {
        String text = "The R71G BRCA1\tmutation | here";

        Assert.assertEquals(Utils.getSnippet(text, 3, 8, 3), "The<<< R71G>>> BR");
        Assert.assertEquals(Utils.getSnippet(text, 9, 14, 20), "The R71G <<<BRCA1>>> mutation   here");
    }
}
