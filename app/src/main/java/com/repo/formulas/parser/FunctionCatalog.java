package com.repo.formulas.parser;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup of built-in spreadsheet functions: category and static
 * complexity weight. Shared by {@link FormulaParser} and the complexity scorer.
 * Unlisted functions are treated as {@link FunctionCategory#MATHEMATICAL} with
 * weight {@value #DEFAULT_WEIGHT}.
 */
public final class FunctionCatalog {

    public static final double DEFAULT_WEIGHT = 0.5;

    /** Recalculated on every pass regardless of precedents */
    public static final Set<String> VOLATILE_FUNCTIONS = Set.of(
            "NOW", "TODAY", "RAND", "RANDBETWEEN", "INDIRECT", "OFFSET");

    public record Entry(FunctionCategory category, double weight) {
    }

    private static final FunctionCatalog DEFAULT = new FunctionCatalog(buildDefaultEntries());

    private final Map<String, Entry> entries;

    public FunctionCatalog(Map<String, Entry> entries) {
        this.entries = Map.copyOf(entries);
    }

    public static FunctionCatalog defaults() {
        return DEFAULT;
    }

    public Entry lookup(String functionName) {
        Entry entry = entries.get(functionName);
        return entry != null ? entry : new Entry(FunctionCategory.MATHEMATICAL, DEFAULT_WEIGHT);
    }

    public double weightOf(String functionName) {
        return lookup(functionName).weight();
    }

    public FunctionCategory categoryOf(String functionName) {
        return lookup(functionName).category();
    }

    public boolean contains(String functionName) {
        return entries.containsKey(functionName);
    }

    public static boolean isVolatile(String functionName) {
        return VOLATILE_FUNCTIONS.contains(functionName);
    }

    public int size() {
        return entries.size();
    }

    private static Map<String, Entry> buildDefaultEntries() {
        Map<String, Entry> map = new HashMap<>();

        add(map, FunctionCategory.MATHEMATICAL,
                "SUM", 0.1, "AVERAGE", 0.1, "COUNT", 0.1, "MAX", 0.1, "MIN", 0.1,
                "ROUND", 0.2, "ABS", 0.1, "SQRT", 0.2, "POWER", 0.3, "MOD", 0.2,
                "PRODUCT", 0.2, "SUBTOTAL", 0.3, "AGGREGATE", 0.4, "SUMPRODUCT", 0.6,
                "SUMIFS", 0.5, "COUNTIFS", 0.5, "AVERAGEIFS", 0.5);

        add(map, FunctionCategory.LOGICAL,
                "IF", 0.3, "AND", 0.2, "OR", 0.2, "NOT", 0.1, "IFERROR", 0.3,
                "IFS", 0.4, "SWITCH", 0.4, "CHOOSE", 0.4, "XOR", 0.3);

        add(map, FunctionCategory.LOOKUP,
                "VLOOKUP", 0.6, "HLOOKUP", 0.6, "INDEX", 0.5, "MATCH", 0.5,
                "XLOOKUP", 0.7, "LOOKUP", 0.5, "FILTER", 0.8, "UNIQUE", 0.7,
                "SORT", 0.7, "SORTBY", 0.8);

        add(map, FunctionCategory.FINANCIAL,
                "PMT", 0.5, "PV", 0.5, "FV", 0.5, "RATE", 0.6, "NPV", 0.6,
                "IRR", 0.7, "XIRR", 0.8, "XNPV", 0.7, "MIRR", 0.7, "SLN", 0.4);

        add(map, FunctionCategory.STATISTICAL,
                "STDEV", 0.3, "VAR", 0.3, "MEDIAN", 0.3, "MODE", 0.3, "PERCENTILE", 0.4,
                "RANK", 0.4, "CORREL", 0.5, "SLOPE", 0.5, "INTERCEPT", 0.5,
                "FORECAST", 0.6, "TREND", 0.7, "LINEST", 0.8, "REGRESSION", 0.7);

        add(map, FunctionCategory.ADVANCED,
                "INDIRECT", 0.9, "OFFSET", 0.7, "ARRAY", 0.8, "EVALUATE", 1.0,
                "FORMULA", 0.9, "SEQUENCE", 0.6, "RANDARRAY", 0.7);

        add(map, FunctionCategory.TEXT,
                "LEFT", 0.2, "RIGHT", 0.2, "MID", 0.3, "LEN", 0.1, "FIND", 0.3,
                "SEARCH", 0.3, "SUBSTITUTE", 0.4, "REPLACE", 0.4, "CONCATENATE", 0.3,
                "TEXTJOIN", 0.5, "REGEX", 0.7);

        add(map, FunctionCategory.DATE_TIME,
                "NOW", 0.8, "TODAY", 0.8, "DATE", 0.2, "TIME", 0.2, "YEAR", 0.1,
                "MONTH", 0.1, "DAY", 0.1, "WEEKDAY", 0.2, "NETWORKDAYS", 0.4,
                "WORKDAY", 0.4, "EDATE", 0.3, "EOMONTH", 0.3);

        add(map, FunctionCategory.DATABASE,
                "DSUM", 0.6, "DCOUNT", 0.6, "DAVERAGE", 0.6, "DMAX", 0.6, "DMIN", 0.6,
                "DGET", 0.7, "DVAR", 0.6, "DSTDEV", 0.6);

        // FORMULA stays ADVANCED: first category wins
        add(map, FunctionCategory.INFORMATION,
                "ISBLANK", 0.1, "ISERROR", 0.1, "ISNUMBER", 0.1, "ISTEXT", 0.1,
                "CELL", 0.4, "INFO", 0.3, "TYPE", 0.2, "FORMULA", 0.5);

        return map;
    }

    private static void add(Map<String, Entry> map, FunctionCategory category, Object... nameWeightPairs) {
        for (int i = 0; i < nameWeightPairs.length; i += 2) {
            String name = (String) nameWeightPairs[i];
            double weight = ((Number) nameWeightPairs[i + 1]).doubleValue();
            map.putIfAbsent(name, new Entry(category, weight));
        }
    }
}
