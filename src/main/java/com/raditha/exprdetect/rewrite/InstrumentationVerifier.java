package com.raditha.exprdetect.rewrite;

import com.raditha.exprdetect.analysis.NamingConvention;
import com.raditha.exprdetect.frontend.CFrontEnd;
import com.raditha.exprdetect.frontend.SourceParseException;
import com.raditha.exprdetect.model.Dialect;
import com.raditha.exprdetect.model.FunctionDecl;
import com.raditha.exprdetect.model.TranslationUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Verifies that instrumented source still parses and that the instrumented
 * function declares the new temporary.
 */
public class InstrumentationVerifier {

    private final CFrontEnd frontEnd;
    private final NameQuery nameQuery;

    public InstrumentationVerifier() {
        this(new CFrontEnd(), new NameQuery());
    }

    public InstrumentationVerifier(CFrontEnd frontEnd, NameQuery nameQuery) {
        this.frontEnd = frontEnd;
        this.nameQuery = nameQuery;
    }

    /**
     * Verify the output of one run.
     *
     * @param fileName     name used in parse diagnostics
     * @param instrumented the rewritten source
     * @param function     name of the function that was instrumented
     * @param plan         the applied plan
     * @param naming       prefixes the plan drew its names from
     */
    public VerificationResult verify(String fileName, String instrumented, String function,
            InstrumentationPlan plan, NamingConvention naming) {
        TranslationUnit unit;
        try {
            unit = frontEnd.parse(fileName, instrumented, Dialect.C);
        } catch (SourceParseException e) {
            return new VerificationResult(false, List.of(e.getMessage()), "Instrumented source does not parse");
        }

        List<String> errors = new ArrayList<>();
        if (plan.temporaryName() != null) {
            Optional<FunctionDecl> target = unit.functionDefinitions().stream()
                    .filter(f -> f.getName().equals(function))
                    .findFirst();
            if (target.isEmpty()) {
                errors.add("Function " + function + " is missing from the output");
            } else {
                int expected = NameQuery.suffixOf(plan.temporaryName(), naming.temporaryPrefix());
                if (nameQuery.maxSuffix(target.get(), naming.temporaryPrefix()) < expected) {
                    errors.add("Temporary " + plan.temporaryName() + " is not declared in " + function);
                }
            }
        }
        if (!errors.isEmpty()) {
            return new VerificationResult(false, errors, "Instrumentation incomplete");
        }
        return new VerificationResult(true, List.of(), "Verification successful");
    }

    /**
     * Result of verification.
     */
    public record VerificationResult(
            boolean success,
            List<String> errors,
            String message) {
    }
}
