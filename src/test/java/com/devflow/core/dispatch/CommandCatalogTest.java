package com.devflow.core.dispatch;

import com.devflow.config.DevflowProperties;
import com.devflow.core.model.CommandAction;
import com.devflow.core.model.CommandOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CommandCatalog}.
 */
class CommandCatalogTest {

    private static CommandCatalog catalog(Map<String, String> overrides) {
        DevflowProperties properties = new DevflowProperties();
        properties.getCommands().putAll(overrides);
        return new CommandCatalog(properties);
    }

    @Test
    @DisplayName("substitutes the project into the default template")
    void defaultTemplate() {
        List<String> line = catalog(Map.of()).resolve(CommandAction.NX_TEST, "web-app", CommandOptions.defaults());

        assertEquals(List.of("npx", "nx", "test", "web-app"), line);
    }

    @Test
    @DisplayName("project-less actions need no project")
    void gitDiff() {
        assertEquals(List.of("git", "diff"),
                catalog(Map.of()).resolve(CommandAction.GIT_DIFF, null, CommandOptions.defaults()));
    }

    @Test
    @DisplayName("rejects a missing project for actions that need one")
    void missingProject() {
        CommandCatalog catalog = catalog(Map.of());

        assertThrows(CommandValidationException.class,
                () -> catalog.resolve(CommandAction.AI_DEBUG, null, CommandOptions.defaults()));
        assertThrows(CommandValidationException.class,
                () -> catalog.resolve(CommandAction.PREPARE_TO_PUSH, "  ", CommandOptions.defaults()));
    }

    @Test
    @DisplayName("appends extra arguments")
    void extraArgs() {
        var options = new CommandOptions(0, List.of("--coverage"), Map.of());

        assertEquals(List.of("npx", "nx", "test", "app", "--coverage"),
                catalog(Map.of()).resolve(CommandAction.NX_TEST, "app", options));
    }

    @Test
    @DisplayName("configured templates override the defaults")
    void override() {
        CommandCatalog catalog = catalog(Map.of("nxTest", "sh -c echo-{project}"));

        assertEquals("sh -c echo-{project}", catalog.template(CommandAction.NX_TEST));
        assertEquals(List.of("sh", "-c", "echo-lib"),
                catalog.resolve(CommandAction.NX_TEST, "lib", CommandOptions.defaults()));
    }

    @Test
    @DisplayName("unknown action keys in configuration fail fast")
    void unknownOverride() {
        assertThrows(IllegalArgumentException.class, () -> catalog(Map.of("deploy", "make deploy")));
    }
}
