package org.Aayush.tempus.testutil;

import org.Aayush.tempus.pddl.PddlParser;
import org.Aayush.tempus.task.Task;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Classpath access to the PDDL fixtures under {@code fixtures/domains} and {@code fixtures/problems}.
 */
public final class Fixtures {
    public static final String SIMPLE_ROBOT = "simple_robot";
    public static final String SIMPLE_DELIVERY = "simple_delivery";
    public static final String BLOCKS_WORLD = "blocks_world";
    public static final String STACK_BLOCKS = "stack_blocks";
    public static final String FACTORY_AUTOMATION = "factory_automation";
    public static final String FACTORY_PRODUCTION = "factory_production";

    private Fixtures() {
    }

    public static String domain(String name) {
        return read("fixtures/domains/" + name + ".pddl");
    }

    public static String problem(String name) {
        return read("fixtures/problems/" + name + ".pddl");
    }

    public static Path domainPath(String name) {
        return path("fixtures/domains/" + name + ".pddl");
    }

    public static Path problemPath(String name) {
        return path("fixtures/problems/" + name + ".pddl");
    }

    public static Task task(String domain, String problem) {
        return new PddlParser().parse(domain(domain), problem(problem));
    }

    public static Task simpleDelivery() {
        return task(SIMPLE_ROBOT, SIMPLE_DELIVERY);
    }

    public static Task stackBlocks() {
        return task(BLOCKS_WORLD, STACK_BLOCKS);
    }

    public static Task factoryProduction() {
        return task(FACTORY_AUTOMATION, FACTORY_PRODUCTION);
    }

    private static String read(String resource) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("missing fixture " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private static Path path(String resource) {
        URL url = Fixtures.class.getClassLoader().getResource(resource);
        if (url == null) {
            throw new IllegalArgumentException("missing fixture " + resource);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
