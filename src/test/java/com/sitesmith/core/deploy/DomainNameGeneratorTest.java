package com.sitesmith.core.deploy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class DomainNameGeneratorTest {

    private static final Pattern SHAPE = Pattern.compile("test-[a-z]+-[a-z]+-[1-9][0-9]{3}\\.example");

    @Test
    @DisplayName("draws adjective, noun and number in order")
    void scriptedDraws() {
        var generator = new DomainNameGenerator("test", "example", DeploymentCoordinatorTest.scripted(1, 4, 3821));
        assertEquals("test-brave-eagle-4821.example", generator.generate());
    }

    @Test
    @DisplayName("lowest and highest draws stay within 1000..9999")
    void numberBounds() {
        var low = new DomainNameGenerator("test", "example", DeploymentCoordinatorTest.scripted(0, 0, 0));
        assertEquals("test-amazing-apple-1000.example", low.generate());

        int lastAdjective = DomainNameGenerator.ADJECTIVES.size() - 1;
        int lastNoun = DomainNameGenerator.NOUNS.size() - 1;
        var high = new DomainNameGenerator("test", "example",
                DeploymentCoordinatorTest.scripted(lastAdjective, lastNoun, 8999));
        assertEquals("test-dynamic-project-9999.example", high.generate());
    }

    @RepeatedTest(20)
    @DisplayName("random names match the hostname shape")
    void shape() {
        var generator = new DomainNameGenerator("test", "example", new Random());
        String name = generator.generate();
        assertTrue(SHAPE.matcher(name).matches(), name);
    }

    @Test
    @DisplayName("prefix and suffix are configurable")
    void customAffixes() {
        var generator = new DomainNameGenerator("demo", "sites.dev", DeploymentCoordinatorTest.scripted(2, 2, 0));
        assertEquals("demo-calm-cloud-1000.sites.dev", generator.generate());
    }
}
