package com.sitesmith.core.deploy;

import com.sitesmith.registry.DomainRegistryProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Generates memorable hostnames of the form
 * {@code {prefix}-{adjective}-{noun}-{1000..9999}.{suffix}}.
 */
@Component
public class DomainNameGenerator {

    static final List<String> ADJECTIVES = List.of(
            "amazing", "brave", "calm", "daring", "eager", "fast", "gentle", "happy",
            "incredible", "jolly", "kind", "lively", "mysterious", "nice", "polite",
            "quiet", "rapid", "smart", "talented", "unique", "vibrant", "wonderful",
            "xcellent", "young", "zealous", "clever", "bright", "honest", "pretty",
            "sequential", "digital", "cosmic", "epic", "stellar", "dynamic");

    static final List<String> NOUNS = List.of(
            "apple", "banana", "cloud", "diamond", "eagle", "forest", "garden",
            "harbor", "island", "jungle", "kingdom", "lake", "mountain", "nest",
            "ocean", "planet", "river", "star", "tiger", "universe", "valley",
            "waterfall", "xylophone", "yacht", "zebra", "drive", "system", "portal",
            "avenue", "path", "journey", "quest", "venture", "mission", "project");

    private final String prefix;
    private final String suffix;
    private final RandomGenerator random;

    @Autowired
    public DomainNameGenerator(DomainRegistryProperties properties) {
        this(properties.getPrefix(), properties.getSuffix(), new SecureRandom());
    }

    public DomainNameGenerator(String prefix, String suffix, RandomGenerator random) {
        this.prefix = prefix;
        this.suffix = suffix;
        this.random = random;
    }

    public String generate() {
        String adjective = ADJECTIVES.get(random.nextInt(ADJECTIVES.size()));
        String noun = NOUNS.get(random.nextInt(NOUNS.size()));
        int number = 1000 + random.nextInt(9000);
        return "%s-%s-%s-%d.%s".formatted(prefix, adjective, noun, number, suffix);
    }
}
