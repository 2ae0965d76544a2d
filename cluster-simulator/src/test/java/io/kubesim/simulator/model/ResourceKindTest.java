/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.model;

import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.kubesim.common.model.InvalidResourceException;
import io.kubesim.simulator.ResourceUtils;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ResourceKindTest {
    @Test
    public void testLookups() {
        assertThat(ResourceKind.forKind("Deployment"), is(ResourceKind.DEPLOYMENT));
        assertThat(ResourceKind.forKind("poddisruptionbudget"), is(ResourceKind.POD_DISRUPTION_BUDGET));
        assertThat(ResourceKind.forResource(ResourceUtils.cronJob("report", "@hourly", "Allow")), is(ResourceKind.CRON_JOB));
        assertThat(ResourceKind.HORIZONTAL_POD_AUTOSCALER.apiVersion(), is("autoscaling/v1"));
        assertThat(ResourceKind.NODE.isNamespaced(), is(false));
        assertThat(ResourceKind.forKind("PersistentVolumeClaim"), is(ResourceKind.PERSISTENT_VOLUME_CLAIM));
        assertThat(ResourceKind.PERSISTENT_VOLUME_CLAIM.isNamespaced(), is(true));
        assertThat(ResourceKind.PERSISTENT_VOLUME.isNamespaced(), is(false));
        assertThat(ResourceKind.STORAGE_CLASS.apiVersion(), is("storage.k8s.io/v1"));
        assertThat(ResourceKind.forResource(ResourceUtils.configMap("settings")), is(ResourceKind.CONFIG_MAP));
    }

    @Test
    public void testUnsupportedKinds() {
        assertThrows(InvalidResourceException.class, () -> ResourceKind.forKind("Ingress"));
        assertThrows(InvalidResourceException.class, () -> ResourceKind.forType(ServiceAccount.class));
    }
}
