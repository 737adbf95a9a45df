package org.wikidata.query.rdf.entitystore.taxonomy;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;
import org.junit.runner.RunWith;

import com.carrotsearch.randomizedtesting.RandomizedRunner;
import com.carrotsearch.randomizedtesting.RandomizedTest;

@RunWith(RandomizedRunner.class)
public class TraversalQueryUnitTest extends RandomizedTest {

    @Test
    public void testBackwardTraversalLooksForSubjects() {
        String sparql = new TraversalQuery(Arrays.asList("Q43229", "Q6256"), "P279", TraversalQuery.Direction.BACKWARD, false).toSparql();
        assertThat(sparql, containsString("VALUES ?root { wd:Q43229 wd:Q6256 }"));
        assertThat(sparql, containsString("?node (wdt:P279)* ?root ."));
        assertThat(sparql, not(containsString("wikibase:label")));
        assertThat(sparql, not(containsString("${")));
    }

    @Test
    public void testForwardTraversalWithLabels() {
        String sparql = new TraversalQuery(Collections.singleton("Q515"), "P279", TraversalQuery.Direction.FORWARD, true).toSparql();
        assertThat(sparql, containsString("VALUES ?root { wd:Q515 }"));
        assertThat(sparql, containsString("?root (wdt:P279)* ?node ."));
        assertThat(sparql, containsString("?nodeLabel"));
        assertThat(sparql, containsString("SERVICE wikibase:label"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTraversalNeedsRoots() {
        new TraversalQuery(Collections.<String>emptyList(), "P279", TraversalQuery.Direction.FORWARD, false);
    }
}
