/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.matchesPattern;

public class NameGeneratorTest {
    @Test
    public void testSameSeedGivesSameNames() {
        NameGenerator first = new NameGenerator(42);
        NameGenerator second = new NameGenerator(42);

        for (int i = 0; i < 10; i++) {
            assertThat(first.generateName("web"), is(second.generateName("web")));
            assertThat(first.uid(), is(second.uid()));
        }
    }

    @Test
    public void testGeneratedNames() {
        NameGenerator names = new NameGenerator(0);

        assertThat(names.generateName("web-6d4b8c"), matchesPattern("web-6d4b8c-[bcdfghjklmnpqrstvwxz2456789]{5}"));
        assertThat(names.uid(), matchesPattern("[0-9a-f]{8}-[0-9a-f]{4}-4[0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}"));
    }

    @Test
    public void testUidsAreUnique() {
        NameGenerator names = new NameGenerator(7);
        Set<String> uids = new HashSet<>();

        for (int i = 0; i < 1000; i++) {
            uids.add(names.uid());
        }

        assertThat(uids.size(), is(1000));
    }
}
