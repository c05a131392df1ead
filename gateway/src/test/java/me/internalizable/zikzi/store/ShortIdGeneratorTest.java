package me.internalizable.zikzi.store;

import me.internalizable.zikzi.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ShortIdGeneratorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
    private final ShortIdGenerator generator = new ShortIdGenerator(clock);

    @Test
    void idsAreTwelveBase62Characters() {
        String id = generator.next();

        assertThat(id).hasSize(ShortIdGenerator.LENGTH).matches("[0-9A-Za-z]+");
        assertThat(ShortIdGenerator.isValid(id)).isTrue();
    }

    @Test
    void idsWithinTheSameMillisecondAreUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(generator.next());
        }

        assertThat(ids).hasSize(1000);
    }

    @Test
    void laterIdsSortAfterEarlierOnes() {
        String first = generator.next();
        clock.advance(Duration.ofMillis(1));
        String second = generator.next();

        assertThat(second.substring(0, 7)).isGreaterThan(first.substring(0, 7));
    }

    @Test
    void rejectsMalformedIds() {
        assertThat(ShortIdGenerator.isValid(null)).isFalse();
        assertThat(ShortIdGenerator.isValid("short")).isFalse();
        assertThat(ShortIdGenerator.isValid("0123456789a-")).isFalse();
    }
}
