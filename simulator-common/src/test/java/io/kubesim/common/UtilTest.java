/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.common;

import io.fabric8.kubernetes.api.model.IntOrString;
import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class UtilTest {
    @Test
    public void testHashStub() {
        String hash = Util.hashStub("image: nginx:1.25");

        assertThat(hash.length(), is(Util.HASH_STUB_LENGTH));
        assertThat(hash.matches("[0-9a-f]{8}"), is(true));
        assertThat(Util.hashStub("image: nginx:1.25"), is(hash));
        assertThat(Util.hashStub("image: nginx:1.26"), is(not(hash)));
    }

    @Test
    public void testScaledValueFromInt() {
        assertThat(Util.scaledValueFromIntOrPercent(new IntOrString(2), 10, true), is(2));
        assertThat(Util.scaledValueFromIntOrPercent(new IntOrString(0), 10, false), is(0));
        assertThat(Util.scaledValueFromIntOrPercent(null, 10, true), is(0));
    }

    @Test
    public void testScaledValueFromPercent() {
        // 25% of 3 = 0.75
        assertThat(Util.scaledValueFromIntOrPercent(new IntOrString("25%"), 3, true), is(1));
        assertThat(Util.scaledValueFromIntOrPercent(new IntOrString("25%"), 3, false), is(0));
        assertThat(Util.scaledValueFromIntOrPercent(new IntOrString("50%"), 4, false), is(2));
        assertThat(Util.scaledValueFromIntOrPercent(new IntOrString("100%"), 7, true), is(7));
    }

    @Test
    public void testInvalidIntOrPercent() {
        assertThrows(IllegalArgumentException.class, () -> Util.scaledValueFromIntOrPercent(new IntOrString("abc"), 3, true));
        assertThrows(IllegalArgumentException.class, () -> Util.scaledValueFromIntOrPercent(new IntOrString("x%"), 3, true));
        assertThrows(IllegalArgumentException.class, () -> Util.scaledValueFromIntOrPercent(new IntOrString("-5%"), 3, true));
    }
}
