package com.devflow.core.dispatch;

import com.devflow.config.DevflowProperties;
import com.devflow.core.model.CommandAction;
import com.devflow.core.model.CommandOptions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each {@link CommandAction} to the command line that implements it.
 * <p>
 * Templates are whitespace-separated; a {@code {project}} token is replaced by the
 * command's project. Per-action overrides come from {@code devflow.commands.<actionId>}.
 */
@Component
public class CommandCatalog {

    static final String PROJECT_TOKEN = "{project}";

    private static final Map<CommandAction, String> DEFAULTS;

    static {
        Map<CommandAction, String> defaults = new EnumMap<>(CommandAction.class);
        defaults.put(CommandAction.AI_DEBUG, "npx nx test {project}");
        defaults.put(CommandAction.NX_TEST, "npx nx test {project}");
        defaults.put(CommandAction.GIT_DIFF, "git diff");
        defaults.put(CommandAction.PREPARE_TO_PUSH, "npx nx lint {project}");
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final Map<CommandAction, String> templates = new EnumMap<>(CommandAction.class);

    public CommandCatalog(DevflowProperties properties) {
        templates.putAll(DEFAULTS);
        properties.getCommands().forEach((key, template) -> {
            CommandAction action = CommandAction.fromId(key)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown action in devflow.commands: " + key));
            if (template == null || template.isBlank()) {
                throw new IllegalArgumentException("Empty command template for " + key);
            }
            templates.put(action, template);
        });
    }

    /** The template in effect for an action, before substitution. */
    public String template(CommandAction action) {
        return templates.get(action);
    }

    /**
     * Resolves the full command line: program first, then its arguments.
     *
     * @throws CommandValidationException if the action needs a project and none was given
     */
    public List<String> resolve(CommandAction action, String project, CommandOptions options) {
        boolean hasProject = project != null && !project.isBlank();
        if (action.requiresProject() && !hasProject) {
            throw new CommandValidationException("Action " + action.id() + " requires a project");
        }
        List<String> commandLine = new ArrayList<>();
        for (String token : templates.get(action).trim().split("\\s+")) {
            if (token.contains(PROJECT_TOKEN)) {
                if (!hasProject) {
                    continue;
                }
                token = token.replace(PROJECT_TOKEN, project);
            }
            commandLine.add(token);
        }
        if (options != null) {
            commandLine.addAll(options.extraArgs());
        }
        return commandLine;
    }
}
