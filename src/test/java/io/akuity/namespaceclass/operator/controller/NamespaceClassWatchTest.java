package io.akuity.namespaceclass.operator.controller;

import io.akuity.namespaceclass.operator.model.NamespaceClass;
import io.akuity.namespaceclass.operator.testing.FakeCluster;
import io.akuity.namespaceclass.operator.testing.Fixtures;
import io.kubernetes.client.extended.controller.reconciler.Request;
import io.kubernetes.client.extended.workqueue.DefaultWorkQueue;
import io.kubernetes.client.extended.workqueue.WorkQueue;
import io.kubernetes.client.informer.ResourceEventHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NamespaceClassWatchTest {

    private FakeCluster cluster;
    private WorkQueue<Request> queue;
    private ResourceEventHandler<NamespaceClass> handler;

    @BeforeEach
    void setUp() {
        cluster = new FakeCluster();
        queue = new DefaultWorkQueue<>();
        NamespaceClassWatch watch = new NamespaceClassWatch(queue, cluster.lookup());
        handler = watch.getResourceEventHandler();
        assertEquals(NamespaceClass.class, watch.getResourceClass());
        assertEquals(Duration.ZERO, watch.getResyncPeriod());

        cluster.putBinding("team-a", "web");
        cluster.putBinding("team-b", "web");
        cluster.putBinding("team-c", "db");
    }

    @AfterEach
    void tearDown() {
        queue.shutDown();
    }

    private Set<Request> drain() throws InterruptedException {
        Set<Request> requests = new HashSet<>();
        while (queue.length() > 0) {
            Request request = queue.get();
            requests.add(request);
            queue.done(request);
        }
        return requests;
    }

    @Test
    void addEnqueuesEveryBindingOfTheClass() throws InterruptedException {
        handler.onAdd(cluster.putClass("web", Fixtures.configMap("a")));

        assertEquals(Set.of(new Request("team-a", "team-a"), new Request("team-b", "team-b")), drain());
    }

    @Test
    void updateWithNewGenerationEnqueues() throws InterruptedException {
        NamespaceClass before = cluster.putClass("db", Fixtures.configMap("a"));
        NamespaceClass after = cluster.putClass("db", Fixtures.configMap("b"));

        handler.onUpdate(before, after);

        assertEquals(Set.of(new Request("team-c", "team-c")), drain());
    }

    @Test
    void updateWithSameGenerationIsIgnored() throws InterruptedException {
        NamespaceClass before = cluster.putClass("db", Fixtures.configMap("a"));
        NamespaceClass after = cluster.putClass("db", Fixtures.configMap("a"));

        handler.onUpdate(before, after);

        assertTrue(drain().isEmpty());
    }

    @Test
    void deleteEnqueuesSoBindingsCanCleanUp() throws InterruptedException {
        NamespaceClass web = cluster.putClass("web");

        handler.onDelete(web, false);

        assertEquals(2, drain().size());
    }

    @Test
    void classWithoutBindingsEnqueuesNothing() throws InterruptedException {
        handler.onAdd(cluster.putClass("unused"));

        assertTrue(drain().isEmpty());
    }
}
