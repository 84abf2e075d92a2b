package com.example.compliance.model;

/**
 * Input of one analysis run. Immutable for the duration of the run.
 *
 * @param requirements    requirements text
 * @param code            source code under review
 * @param tests           test cases
 * @param documentation   accompanying documentation, may be empty
 * @param securityEnabled whether the security stage runs
 */
public record AnalysisBundle(
        String requirements,
        String code,
        String tests,
        String documentation,
        boolean securityEnabled
) {

    /**
     * Null texts become empty strings. A bundle with nothing to analyze is rejected.
     *
     * @throws IllegalArgumentException if requirements, code and tests are all blank
     */
    public AnalysisBundle {
        requirements = requirements != null ? requirements : "";
        code = code != null ? code : "";
        tests = tests != null ? tests : "";
        documentation = documentation != null ? documentation : "";
        if (requirements.isBlank() && code.isBlank() && tests.isBlank()) {
            throw new IllegalArgumentException(
                    "Nothing to analyze: requirements, code and test cases are all empty");
        }
    }
}
