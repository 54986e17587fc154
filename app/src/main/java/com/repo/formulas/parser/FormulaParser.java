package com.repo.formulas.parser;

import com.repo.formulas.scoring.ComplexityScorer;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-driven spreadsheet formula parser.
 * Extracts references, ranges, function calls, external workbooks and table
 * references, then scores the formula on its own (no dependency context).
 *
 * <p>
 * Stateless after construction and safe to share between threads.
 */
public class FormulaParser {

    // [Book.xlsx]Sheet1!A1 or [Book.xlsx]'Sheet Name'!$A$1
    private static final Pattern EXTERNAL_REF = Pattern.compile(
            "\\[([^\\]]+)\\](?:'((?:[^']|'')+)'|([A-Za-z0-9_]+))!(\\$?)([A-Z]{1,3})(\\$?)(\\d{1,7})(?![A-Za-z0-9_(])");

    // Sheet1!A1 or 'Sheet Name'!A1
    private static final Pattern SHEET_REF = Pattern.compile(
            "(?:'((?:[^']|'')+)'|([A-Za-z0-9_]+))!(\\$?)([A-Z]{1,3})(\\$?)(\\d{1,7})(?![A-Za-z0-9_(])");

    // A1, $A$1, $A1, A$1
    private static final Pattern CELL_REF = Pattern.compile(
            "(?<![A-Za-z0-9_$.])(\\$?)([A-Z]{1,3})(\\$?)(\\d{1,7})(?![A-Za-z0-9_(!\\[])");

    private static final Pattern RANGE_REF = Pattern.compile(
            "(?<![A-Za-z0-9_$.])\\$?[A-Z]{1,3}\\$?\\d{1,7}:\\$?[A-Z]{1,3}\\$?\\d{1,7}(?![A-Za-z0-9_(])");

    private static final Pattern FUNCTION_CALL = Pattern.compile(
            "(?<![A-Za-z0-9_.$])([A-Za-z_][A-Za-z0-9_.]*)\\s*\\(");

    // Table[Column], Table[@Column]
    private static final Pattern TABLE_REF = Pattern.compile(
            "([A-Za-z0-9_]+)\\[(@?)([A-Za-z0-9_\\s]+)\\]");

    private static final Pattern QUALIFIER = Pattern.compile("'(?:[^']|'')*'|\\[[^\\]]*\\]");

    // Prefixes Excel writes in front of newer functions in stored formulas
    private static final List<String> STORAGE_PREFIXES = List.of("_XLFN.", "_XLWS.", "_XLUDF.");

    private final FunctionCatalog catalog;
    private final ComplexityScorer scorer;

    public FormulaParser() {
        this(FunctionCatalog.defaults());
    }

    public FormulaParser(FunctionCatalog catalog) {
        this(catalog, new ComplexityScorer(catalog));
    }

    public FormulaParser(FunctionCatalog catalog, ComplexityScorer scorer) {
        this.catalog = catalog;
        this.scorer = scorer;
    }

    public ParsedFormula parseFormula(String formula) {
        return parseFormula(formula, null);
    }

    /**
     * Parse a formula into its components. Never throws: problems are listed in
     * {@link ParsedFormula#parsingErrors()} and an internal fault produces a
     * result flagged {@link ParsedFormula#failed()}.
     *
     * @param formula      formula text, with or without the leading '='
     * @param currentSheet sheet owning the formula, or null when unknown
     */
    public ParsedFormula parseFormula(String formula, String currentSheet) {
        if (formula == null) {
            return ParsedFormula.failed(null, currentSheet, "Formula text is null");
        }
        try {
            String text = normalize(formula);
            boolean isArray = isArrayWrapped(text);
            List<String> errors = new ArrayList<>(validateFormulaSyntax(text).errors());

            String literalMasked = maskStringLiterals(text);
            String structureMasked = maskQualifiers(literalMasked);
            List<int[]> claimed = new ArrayList<>();

            List<String> ranges = parseRanges(text, literalMasked, claimed);
            List<String> tables = parseTableReferences(text, literalMasked, claimed);
            List<CellReference> references = parseCellReferences(text, literalMasked, structureMasked, claimed,
                    errors);
            List<FunctionCall> functions = parseFunctions(text, structureMasked, errors);
            List<String> externals = parseExternalReferences(literalMasked);

            ParsedFormula draft = new ParsedFormula(
                    text, currentSheet, references, functions, ranges, externals, tables,
                    isArray, !tables.isEmpty(), 0.0, ComplexityLevel.SIMPLE, errors, false);

            return draft.withComplexity(scorer.score(draft).complexityScore());
        } catch (RuntimeException e) {
            System.err.println("Warning: Formula parsing failed for '" + formula + "': " + e);
            return ParsedFormula.failed(formula, currentSheet, String.valueOf(e.getMessage()));
        }
    }

    /**
     * Fast structural pre-check, independent of full parsing.
     * An array formula wrapped as {=...} is checked on its inner text.
     */
    public SyntaxValidation validateFormulaSyntax(String formula) {
        List<String> errors = new ArrayList<>();
        if (formula == null) {
            errors.add("Formula is null");
            return SyntaxValidation.of(errors);
        }

        String text = formula;
        if (text.startsWith("{=") && text.endsWith("}")) {
            text = text.substring(1, text.length() - 1);
        }

        if (!text.startsWith("=")) {
            errors.add("Formula must start with '='");
        }

        int open = 0;
        int close = 0;
        int quotes = 0;
        boolean inQuotes = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                quotes++;
                inQuotes = !inQuotes;
            } else if (!inQuotes && c == '(') {
                open++;
            } else if (!inQuotes && c == ')') {
                close++;
            }
        }
        if (open != close) {
            errors.add("Unbalanced parentheses: " + open + " open, " + close + " close");
        }
        if (quotes % 2 != 0) {
            errors.add("Unbalanced quotes");
        }
        if (text.contains(",,,")) {
            errors.add("Multiple consecutive commas");
        }
        if (text.endsWith(",")) {
            errors.add("Formula ends with comma");
        }
        return SyntaxValidation.of(errors);
    }

    /**
     * Re-render a bare reference with the '$' markers of {@code targetType}.
     * Input that is not a bare reference is returned unchanged.
     */
    public String convertReferenceFormat(String reference, ReferenceType targetType) {
        if (reference == null) {
            return null;
        }
        Matcher m = CELL_REF.matcher(reference.trim());
        if (!m.matches()) {
            return reference;
        }
        String column = m.group(2);
        String row = m.group(4);
        return (targetType.isColumnAbsolute() ? "$" : "") + column
                + (targetType.isRowAbsolute() ? "$" : "") + row;
    }

    public List<String> extractWorkbookReferences(String formula) {
        if (formula == null) {
            return List.of();
        }
        return parseExternalReferences(maskStringLiterals(formula));
    }

    /**
     * True when the formula calls a volatile function. Text inside string
     * literals does not count.
     */
    public boolean isVolatileFormula(String formula) {
        if (formula == null) {
            return false;
        }
        Matcher m = FUNCTION_CALL.matcher(maskQualifiers(maskStringLiterals(formula)));
        while (m.find()) {
            if (FunctionCatalog.isVolatile(canonicalName(m.group(1)))) {
                return true;
            }
        }
        return false;
    }

    // === Extraction ===

    private List<String> parseRanges(String text, String masked, List<int[]> claimed) {
        Set<String> ranges = new LinkedHashSet<>();
        Matcher m = RANGE_REF.matcher(masked);
        while (m.find()) {
            ranges.add(text.substring(m.start(), m.end()));
            claimed.add(new int[] { m.start(), m.end() });
        }
        return new ArrayList<>(ranges);
    }

    private List<String> parseTableReferences(String text, String masked, List<int[]> claimed) {
        Set<String> tables = new LinkedHashSet<>();
        Matcher m = TABLE_REF.matcher(masked);
        while (m.find()) {
            tables.add(text.substring(m.start(), m.end()));
            claimed.add(new int[] { m.start(), m.end() });
        }
        return new ArrayList<>(tables);
    }

    /**
     * External references first, then sheet-qualified, then bare. A match that
     * overlaps a span claimed earlier (range, table, or higher-priority
     * reference) is skipped. Bare references are scanned with sheet and
     * workbook names blanked, so a name such as 'Q1' is never read as a cell.
     */
    private List<CellReference> parseCellReferences(String text, String masked, String structureMasked,
            List<int[]> claimed, List<String> errors) {
        List<CellReference> references = new ArrayList<>();

        Matcher ext = EXTERNAL_REF.matcher(masked);
        while (ext.find()) {
            if (overlaps(claimed, ext.start(), ext.end()))
                continue;
            claimed.add(new int[] { ext.start(), ext.end() });
            String sheet = unquote(ext.group(2), ext.group(3));
            addReference(references, errors, text, ext.start(), ext.end(),
                    ext.group(1), sheet, ext.group(4), ext.group(5), ext.group(6), ext.group(7));
        }

        Matcher sheetRef = SHEET_REF.matcher(masked);
        while (sheetRef.find()) {
            if (overlaps(claimed, sheetRef.start(), sheetRef.end()))
                continue;
            claimed.add(new int[] { sheetRef.start(), sheetRef.end() });
            String sheet = unquote(sheetRef.group(1), sheetRef.group(2));
            addReference(references, errors, text, sheetRef.start(), sheetRef.end(),
                    null, sheet, sheetRef.group(3), sheetRef.group(4), sheetRef.group(5), sheetRef.group(6));
        }

        Matcher bare = CELL_REF.matcher(structureMasked);
        while (bare.find()) {
            if (overlaps(claimed, bare.start(), bare.end()))
                continue;
            claimed.add(new int[] { bare.start(), bare.end() });
            addReference(references, errors, text, bare.start(), bare.end(),
                    null, null, bare.group(1), bare.group(2), bare.group(3), bare.group(4));
        }

        references.sort(Comparator.comparingInt(CellReference::position));
        return references;
    }

    private void addReference(List<CellReference> references, List<String> errors, String text,
            int start, int end, String workbook, String sheet,
            String colAbs, String column, String rowAbs, String rowDigits) {
        String original = text.substring(start, end);
        int row = Integer.parseInt(rowDigits);
        if (row < 1 || row > CellAddress.MAX_ROW) {
            errors.add("Reference " + original + " is outside the sheet bounds");
            return;
        }
        CellAddress address = new CellAddress(workbook, sheet, column, row);
        ReferenceType type = ReferenceType.of(!colAbs.isEmpty(), !rowAbs.isEmpty());
        references.add(new CellReference(address, type, original, start));
    }

    private List<FunctionCall> parseFunctions(String text, String masked, List<String> errors) {
        List<FunctionCall> functions = new ArrayList<>();
        Matcher m = FUNCTION_CALL.matcher(masked);

        while (m.find()) {
            String name = canonicalName(m.group(1));
            int start = m.start();
            int open = m.end() - 1;
            int close = findClosingParen(masked, open);

            if (close < 0) {
                errors.add("Unclosed parenthesis in call to " + name + " at position " + start);
                continue;
            }

            functions.add(new FunctionCall(
                    name,
                    splitParameters(text, masked, open + 1, close),
                    Math.max(0, unmatchedOpenParens(masked, start)),
                    catalog.weightOf(name),
                    start,
                    close + 1));
        }
        return functions;
    }

    private List<String> parseExternalReferences(String masked) {
        Set<String> workbooks = new LinkedHashSet<>();
        Matcher m = EXTERNAL_REF.matcher(masked);
        while (m.find()) {
            workbooks.add(m.group(1));
        }
        return new ArrayList<>(workbooks);
    }

    // === Scanning helpers ===

    private int findClosingParen(String masked, int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0)
                    return i;
            }
        }
        return -1;
    }

    private int unmatchedOpenParens(String masked, int end) {
        int depth = 0;
        for (int i = 0; i < end; i++) {
            char c = masked.charAt(i);
            if (c == '(')
                depth++;
            else if (c == ')')
                depth--;
        }
        return depth;
    }

    /**
     * Split the argument list between {@code from} and {@code to} at top-level
     * commas. Positions come from the masked text, slices from the original.
     */
    private List<String> splitParameters(String text, String masked, int from, int to) {
        if (text.substring(from, to).isBlank()) {
            return List.of();
        }
        List<String> parameters = new ArrayList<>();
        int depth = 0;
        int segmentStart = from;
        for (int i = from; i < to; i++) {
            char c = masked.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parameters.add(text.substring(segmentStart, i).strip());
                segmentStart = i + 1;
            }
        }
        String last = text.substring(segmentStart, to).strip();
        if (!last.isEmpty()) {
            parameters.add(last);
        }
        return parameters;
    }

    /**
     * Blank out the contents of double-quoted literals, keeping offsets.
     * A doubled quote inside a literal toggles twice and stays masked.
     */
    private static String maskStringLiterals(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean inQuotes = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                inQuotes = !inQuotes;
                sb.append(c);
            } else {
                sb.append(inQuotes ? ' ' : c);
            }
        }
        return sb.toString();
    }

    /**
     * Additionally blank quoted sheet names and bracketed workbook/column names,
     * so parentheses inside them do not disturb call matching.
     */
    private static String maskQualifiers(String masked) {
        StringBuilder sb = new StringBuilder(masked);
        Matcher m = QUALIFIER.matcher(masked);
        while (m.find()) {
            for (int i = m.start() + 1; i < m.end() - 1; i++) {
                sb.setCharAt(i, ' ');
            }
        }
        return sb.toString();
    }

    private static boolean overlaps(List<int[]> claimed, int start, int end) {
        for (int[] span : claimed) {
            if (start < span[1] && span[0] < end)
                return true;
        }
        return false;
    }

    private static String unquote(String quoted, String plain) {
        return quoted != null ? quoted.replace("''", "'") : plain;
    }

    private static String canonicalName(String rawName) {
        String name = rawName.toUpperCase(Locale.ROOT);
        for (String prefix : STORAGE_PREFIXES) {
            if (name.startsWith(prefix)) {
                return name.substring(prefix.length());
            }
        }
        return name;
    }

    private static String normalize(String formula) {
        String text = formula.strip();
        if (isArrayWrapped(text) || text.startsWith("=")) {
            return text;
        }
        return "=" + text;
    }

    private static boolean isArrayWrapped(String text) {
        return text.length() >= 2 && text.startsWith("{") && text.endsWith("}");
    }
}
