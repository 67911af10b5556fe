package com.raditha.exprdetect.rewrite;

import com.raditha.exprdetect.analysis.NamingConvention;
import com.raditha.exprdetect.config.DetectorConfig;
import com.raditha.exprdetect.config.InstrumentMode;
import com.raditha.exprdetect.model.CType;
import com.raditha.exprdetect.model.Decl;
import com.raditha.exprdetect.model.Expr;
import com.raditha.exprdetect.model.InclusionDirective;
import com.raditha.exprdetect.model.Range;
import com.raditha.exprdetect.model.StmtKind;
import com.raditha.exprdetect.model.TranslationUnit;
import com.raditha.exprdetect.selection.CapturedInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a captured instance into the text edits that instrument it.
 * <p>
 * The value of the expression is stored in a fresh temporary declared right
 * before the statement, and the expression itself is replaced by the
 * temporary. A static guard counts how often the statement runs, so the
 * value is reported or checked on exactly one execution:
 *
 * <pre>
 * int __cvise_expr_tmp_1 = a[i];
 * static int __cvise_printed_1 = 0;
 * if (__cvise_printed_1 == __CVISE_INSTANCE_NUMBER) {
 *   printf("cvise_value(%d)\n", __cvise_expr_tmp_1);
 * }
 * ++__cvise_printed_1;
 * x = (__cvise_expr_tmp_1) + 1;
 * </pre>
 */
public class RewritePlanner {

    private static final Logger logger = LoggerFactory.getLogger(RewritePlanner.class);

    private final DetectorConfig config;
    private final NameQuery nameQuery;

    public RewritePlanner(DetectorConfig config) {
        this(config, new NameQuery());
    }

    public RewritePlanner(DetectorConfig config, NameQuery nameQuery) {
        this.config = config;
        this.nameQuery = nameQuery;
    }

    /**
     * Plan the emit or check instrumentation of {@code instance}.
     *
     * @param referenceValue value compared against in check mode, ignored
     *                       otherwise
     */
    public InstrumentationPlan planInstrumentation(TranslationUnit unit, CapturedInstance instance,
            InstrumentMode mode, String referenceValue) {
        if (mode == InstrumentMode.REPLACE) {
            throw new IllegalArgumentException("Use planReplacement for replace mode");
        }
        NamingConvention naming = config.naming();
        SupportFunction support = SupportFunction.forMode(mode);
        Range statement = instance.statement().range();
        Expr expression = instance.expression();

        String prototype = needsPrototype(unit, support, statement) ? support.declaration() : null;

        String guardPrefix = mode == InstrumentMode.CHECK ? naming.checkedPrefix() : naming.printedPrefix();
        String temporary = naming.temporaryPrefix()
                + (nameQuery.maxSuffix(instance.function(), naming.temporaryPrefix()) + 1);
        String guard = guardPrefix + (nameQuery.maxSuffix(instance.function(), guardPrefix) + 1);

        List<String> lines = new ArrayList<>();
        lines.add(temporaryType(expression.type()) + " " + temporary + " = "
                + unit.textOf(expression.range()) + ";");
        lines.add("static int " + guard + " = 0;");
        lines.add("if (" + guard + " == " + config.instanceNumber() + ") {");
        if (mode == InstrumentMode.CHECK) {
            lines.add("  if (" + temporary + " != " + referenceValue + ") " + support.functionName() + "();");
        } else {
            lines.add("  " + support.functionName() + "(\"cvise_value(%" + FormatSpecifier.of(expression.type())
                    + ")\\n\", " + temporary + ");");
        }
        lines.add("}");
        lines.add("++" + guard + ";");

        String indent = unit.indentationAt(statement.startOffset());
        String eol = unit.lineSeparator();
        String block = String.join(eol + indent, lines) + eol + indent;

        boolean declaration = instance.statement().kind() == StmtKind.DECLARATION;
        String replacement = declaration ? temporary : "(" + temporary + ")";
        boolean braced = instance.unbraced() && !declaration;

        logger.debug("Instrumenting {} at {} with {} and {}", unit.textOf(expression.range()),
                expression.range().toDisplayString(), temporary, guard);
        return new InstrumentationPlan(temporary, guard, prototype, statement.startOffset(), block, braced,
                statement.endOffset(), expression.range(), replacement, eol);
    }

    /**
     * Plan the verbatim replacement of the selected expression.
     */
    public InstrumentationPlan planReplacement(CapturedInstance instance, String replacement) {
        return InstrumentationPlan.replacementOnly(instance.expression().range(), replacement);
    }

    /**
     * A prototype is needed unless the function is declared, or its header
     * included, before the statement.
     */
    boolean needsPrototype(TranslationUnit unit, SupportFunction support, Range statement) {
        Range functionLoc = unit.firstFunctionNamed(support.functionName()).map(Decl::getRange).orElse(null);
        Range headerLoc = unit.firstInclusionOf(support.header()).map(InclusionDirective::range).orElse(null);
        return (functionLoc == null || statement.isBefore(functionLoc))
                && (headerLoc == null || statement.isBefore(headerLoc));
    }

    /**
     * Spelling of the temporary's type. An enumeration with neither tag nor
     * typedef name cannot be named, so its temporary is an {@code int}.
     */
    static String temporaryType(CType type) {
        String spelling = type.spelling();
        if (spelling.endsWith("enum")) {
            return spelling.substring(0, spelling.length() - "enum".length()) + "int";
        }
        return spelling;
    }
}
