/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.model;

import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.fabric8.kubernetes.api.model.PodTemplateSpecBuilder;
import io.kubesim.common.model.Labels;
import io.kubesim.simulator.ResourceUtils;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class TemplateHashTest {
    @Test
    public void testHashIsStable() {
        String hash = TemplateHash.of(ResourceUtils.template("web", "nginx:1.25"));

        assertThat(hash.length(), is(8));
        assertThat(TemplateHash.of(ResourceUtils.template("web", "nginx:1.25")), is(hash));
    }

    @Test
    public void testImageChangesHash() {
        assertThat(TemplateHash.of(ResourceUtils.template("web", "nginx:1.26")), is(not(TemplateHash.of(ResourceUtils.template("web", "nginx:1.25")))));
    }

    @Test
    public void testLabelOrderDoesNotMatter() {
        Map<String, String> ab = new LinkedHashMap<>();
        ab.put("a", "1");
        ab.put("b", "2");

        Map<String, String> ba = new LinkedHashMap<>();
        ba.put("b", "2");
        ba.put("a", "1");

        PodTemplateSpec first = new PodTemplateSpecBuilder(ResourceUtils.template("web", "nginx:1.25")).editMetadata().withLabels(ab).endMetadata().build();
        PodTemplateSpec second = new PodTemplateSpecBuilder(ResourceUtils.template("web", "nginx:1.25")).editMetadata().withLabels(ba).endMetadata().build();

        assertThat(TemplateHash.of(first), is(TemplateHash.of(second)));
    }

    @Test
    public void testPodTemplateHashLabelIsIgnored() {
        PodTemplateSpec template = ResourceUtils.template("web", "nginx:1.25");
        PodTemplateSpec labeled = new PodTemplateSpecBuilder(template).editMetadata().addToLabels(Labels.POD_TEMPLATE_HASH_LABEL, "abcdef12").endMetadata().build();

        assertThat(TemplateHash.of(labeled), is(TemplateHash.of(template)));
    }

    @Test
    public void testEmptyValuesAreIgnored() {
        PodTemplateSpec template = ResourceUtils.template("web", "nginx:1.25");
        PodTemplateSpec withEmptyAnnotations = new PodTemplateSpecBuilder(template).editMetadata().withAnnotations(Map.of()).endMetadata().build();

        assertThat(TemplateHash.of(withEmptyAnnotations), is(TemplateHash.of(template)));
    }
}
