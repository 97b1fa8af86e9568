package io.xqueue.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void workerThreadsAreNumberedDaemons() {
        DaemonThreadFactory factory = new DaemonThreadFactory("xqueue-python-");

        Thread first = factory.newThread(() -> {
        });
        Thread second = factory.newThread(() -> {
        });

        assertTrue(first.isDaemon());
        assertEquals("xqueue-python-1", first.getName());
        assertEquals("xqueue-python-2", second.getName());
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
