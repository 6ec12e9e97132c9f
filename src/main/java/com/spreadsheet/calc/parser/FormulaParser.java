package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.exceptions.FormulaParseException;
import com.spreadsheet.calc.models.CellRange;
import com.spreadsheet.calc.models.CellRef;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns formula text into an {@link Expression}. Pure: the only state is the grid
 * size that references are validated against, and failures never touch any cell.
 *
 * Recognised forms (whitespace ignored, case-insensitive):
 * - integer literal: "42", "-7"
 * - cell reference: "B3"
 * - binary operation: "A1+3", "4*B2", "A1/-2"
 * - range function: "SUM(A1:B3)", also AVG, MIN, MAX, STDEV
 * - sleep: "SLEEP(2)", "SLEEP(A1)"
 */
public class FormulaParser {

    /** Marks cell input as a formula rather than a literal. */
    public static final char FORMULA_PREFIX = '=';

    private static final Pattern INTEGER_PATTERN = Pattern.compile("^[+-]?[0-9]+$");
    private static final Pattern RANGE_FUNCTION_PATTERN =
            Pattern.compile("^(SUM|AVG|MIN|MAX|STDEV)\\(([^()]*)\\)$");
    private static final Pattern SLEEP_PATTERN = Pattern.compile("^SLEEP\\(([^()]*)\\)$");

    private final int rows;
    private final int cols;

    public FormulaParser(int rows, int cols) {
        this.rows = rows;
        this.cols = cols;
    }

    /**
     * Parses the text after the leading '='.
     *
     * @throws FormulaParseException if the text is not one of the recognised forms
     */
    public Expression parse(String body) {
        if (body == null) {
            throw new FormulaParseException("Empty formula");
        }
        String text = body.replaceAll("\\s+", "").toUpperCase();
        if (text.isEmpty()) {
            throw new FormulaParseException("Empty formula");
        }

        Matcher rangeMatcher = RANGE_FUNCTION_PATTERN.matcher(text);
        if (rangeMatcher.matches()) {
            RangeFunctionType type = RangeFunctionType.valueOf(rangeMatcher.group(1));
            CellRange range = CellReferenceParser.parseRange(rangeMatcher.group(2), rows, cols)
                    .orElseThrow(() -> new FormulaParseException("Invalid range in " + body));
            return new RangeFunction(type, range);
        }

        Matcher sleepMatcher = SLEEP_PATTERN.matcher(text);
        if (sleepMatcher.matches()) {
            return new SleepFunction(parseOperand(sleepMatcher.group(1), body));
        }

        // The operator is the first + - * / after position 0; a sign at 0 belongs to the literal
        int opIndex = -1;
        for (int i = 1; i < text.length(); i++) {
            if (Operator.fromSymbol(text.charAt(i)) != null) {
                opIndex = i;
                break;
            }
        }

        if (opIndex > 0) {
            Operator operator = Operator.fromSymbol(text.charAt(opIndex));
            Operand left = parseOperand(text.substring(0, opIndex), body);
            Operand right = parseOperand(text.substring(opIndex + 1), body);
            return new BinaryOperation(operator, left, right);
        }

        Operand single = parseOperand(text, body);
        if (single.isReference()) {
            return new BinaryOperation(Operator.PLUS, single, Operand.literal(0));
        }
        return new Constant(single.getLiteral());
    }

    /**
     * Parses literal (non-formula) cell input such as "12" or "-3".
     *
     * @throws FormulaParseException if the text is not a 32-bit integer
     */
    public static int parseLiteral(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (!INTEGER_PATTERN.matcher(trimmed).matches()) {
            throw new FormulaParseException("Not an integer: '" + text + "'");
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            throw new FormulaParseException("Integer out of range: '" + text + "'");
        }
    }

    private Operand parseOperand(String token, String body) {
        if (INTEGER_PATTERN.matcher(token).matches()) {
            try {
                return Operand.literal(Integer.parseInt(token));
            } catch (NumberFormatException e) {
                throw new FormulaParseException("Integer out of range in " + body);
            }
        }
        Optional<CellRef> ref = CellReferenceParser.parseCell(token, rows, cols);
        return ref.map(Operand::reference)
                .orElseThrow(() -> new FormulaParseException("Invalid operand '" + token + "' in " + body));
    }
}
