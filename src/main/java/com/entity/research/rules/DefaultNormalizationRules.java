package com.entity.research.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Built-in rules for organization names: legal-form suffixes, a leading article,
 * common abbreviations used in fund and investor names, and punctuation cleanup.
 */
public final class DefaultNormalizationRules {

    // Suffix must be separated from the name by a comma or whitespace.
    private static final String SUFFIX_PREFIX = "(?:\\s*,\\s*|\\s+)";

    private static final Map<String, String> ABBREVIATIONS = Map.ofEntries(
            Map.entry("int'l", "international"),
            Map.entry("intl", "international"),
            Map.entry("assoc", "associates"),
            Map.entry("mgmt", "management"),
            Map.entry("svcs", "services"),
            Map.entry("tech", "technology"),
            Map.entry("sys", "systems"),
            Map.entry("grp", "group"),
            Map.entry("hldgs", "holdings"),
            Map.entry("invt", "investment"),
            Map.entry("invts", "investments"),
            Map.entry("ptnrs", "partners"),
            Map.entry("ptr", "partners")
    );

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getSuffixRules());
        engine.addRules(getAbbreviationRules());
        engine.addRules(getCommonRules());
        return engine;
    }

    /**
     * Legal-form suffixes and the leading "The".
     */
    public static List<NormalizationRule> getSuffixRules() {
        return List.of(
                suffix("suffix-inc", "(Inc|Incorporated)\\.?"),
                suffix("suffix-ltd", "(Ltd|Limited)\\.?"),
                suffix("suffix-corp", "(Corp|Corporation)\\.?"),
                suffix("suffix-co", "(Co|Company)\\.?"),
                suffix("suffix-sa", "S\\.?A\\.?"),
                suffix("suffix-llc", "(LLC|L\\.L\\.C)\\.?"),
                suffix("suffix-pllc", "(PLLC|P\\.L\\.L\\.C)\\.?"),
                suffix("suffix-llp", "(LLP|L\\.L\\.P)\\.?"),
                suffix("suffix-lp", "(LP|L\\.P)\\.?"),
                suffix("suffix-plc", "(PLC|P\\.L\\.C)\\.?"),
                suffix("suffix-gmbh", "GmbH"),
                suffix("suffix-ag", "AG"),
                suffix("suffix-nv", "N\\.?V\\.?"),
                suffix("suffix-bv", "B\\.?V\\.?"),

                NormalizationRule.builder()
                        .name("prefix-the")
                        .pattern("^The\\s+")
                        .replacement("")
                        .priority(20)
                        .build()
        );
    }

    /**
     * Whole-word abbreviation expansion, e.g. "Intl Hldgs" to "international holdings".
     */
    public static List<NormalizationRule> getAbbreviationRules() {
        List<NormalizationRule> rules = new ArrayList<>();
        ABBREVIATIONS.forEach((abbreviation, expansion) -> rules.add(
                NormalizationRule.builder()
                        .name("abbrev-" + abbreviation.replace("'", ""))
                        .pattern("(?<![\\w'])" + abbreviation.replace(".", "\\.") + "\\.?(?![\\w'])")
                        .replacement(expansion)
                        .priority(40)
                        .build()));
        return rules;
    }

    /**
     * Rules that apply to every name regardless of origin.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("common-and")
                        .pattern("\\s+and\\s+")
                        .replacement(" ")
                        .priority(50)
                        .build(),

                NormalizationRule.builder()
                        .name("common-ampersand")
                        .pattern("\\s*&\\s*")
                        .replacement(" ")
                        .priority(50)
                        .build(),

                // Punctuation becomes a separator; alphanumerics and spaces stay
                NormalizationRule.builder()
                        .name("common-special-chars")
                        .pattern("[^a-zA-Z0-9\\s]")
                        .replacement(" ")
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("common-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }

    private static NormalizationRule suffix(String name, String form) {
        return NormalizationRule.builder()
                .name(name)
                .pattern(SUFFIX_PREFIX + form + "\\s*$")
                .replacement("")
                .priority(10)
                .repeatable(true)
                .build();
    }
}
