package com.devflow.core.batch;

import com.devflow.core.model.OutputType;

import java.util.List;

/**
 * Classification of expected output files after a command ran.
 */
public record OutputValidation(List<OutputType> valid, List<OutputType> missing, List<OutputType> corrupt) {

    public OutputValidation {
        valid = List.copyOf(valid);
        missing = List.copyOf(missing);
        corrupt = List.copyOf(corrupt);
    }

    public boolean allValid() {
        return missing.isEmpty() && corrupt.isEmpty();
    }
}
