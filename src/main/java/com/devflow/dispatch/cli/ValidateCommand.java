package com.devflow.dispatch.cli;

import com.devflow.core.batch.BatchCoordinator;
import com.devflow.core.batch.OutputValidation;
import com.devflow.core.model.OutputType;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: devflow validate [types...]
 * <p>
 * Classifies generated output files as valid, missing or corrupt. With no types, checks all.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate generated output files")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(arity = "0..*", description = "Output types: ai-debug-context, jest-output, diff, pr-description")
    private List<String> types = new ArrayList<>();

    private final BatchCoordinator batchCoordinator;

    public ValidateCommand(BatchCoordinator batchCoordinator) {
        this.batchCoordinator = batchCoordinator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        List<OutputType> expected = new ArrayList<>();
        if (types.isEmpty()) {
            expected.addAll(Arrays.asList(OutputType.values()));
        }
        for (String t : types) {
            expected.add(OutputType.fromId(t)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown output type: " + t)));
        }
        OutputValidation validation = batchCoordinator.validateCommandOutputs(expected);
        ConsoleOutput.validation(validation);
        return validation.allValid() ? 0 : 1;
    }
}
