package rollingplan.platform;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.ArrayList;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class InMemoryPlatformRegistryTest {

    private static PlatformHandle platform(String id) {
        PlatformHandle handle = mock(PlatformHandle.class);
        when(handle.getId()).thenReturn(id);
        return handle;
    }

    @Test
    void platformsAreReturnedSortedById() {
        InMemoryPlatformRegistry registry = new InMemoryPlatformRegistry();
        registry.register(platform("C"));
        registry.register(platform("A"));
        registry.register(platform("B"));

        Map<String, PlatformHandle> all = registry.getAllPlatforms();

        assertEquals(Arrays.asList("A", "B", "C"), new ArrayList<>(all.keySet()));
        assertThrows(UnsupportedOperationException.class, () -> all.remove("A"));
    }

    @Test
    void reRegistrationReplaces() {
        InMemoryPlatformRegistry registry = new InMemoryPlatformRegistry();
        PlatformHandle replacement = platform("A");
        registry.register(platform("A"));
        registry.register(replacement);

        assertEquals(1, registry.size());
        assertSame(replacement, registry.getAllPlatforms().get("A"));
    }

    @Test
    void unregisterRemoves() {
        InMemoryPlatformRegistry registry = new InMemoryPlatformRegistry();
        registry.register(platform("A"));

        assertTrue(registry.unregister("A"));
        assertFalse(registry.unregister("A"));
        assertTrue(registry.getAllPlatforms().isEmpty());
    }
}
