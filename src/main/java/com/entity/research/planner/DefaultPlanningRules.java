package com.entity.research.planner;

import com.entity.research.core.model.EntityFields;
import com.entity.research.core.model.EntityProfile;
import com.entity.research.core.model.EntityType;
import com.entity.research.strategy.StrategyKind;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Built-in planning rules, one per strategy kind.
 */
public final class DefaultPlanningRules {

    static final double HUNDRED_MILLION = 100_000_000d;
    static final double BILLION = 1_000_000_000d;
    static final double TEN_BILLION = 10 * BILLION;
    static final double HUNDRED_BILLION = 100 * BILLION;
    static final double TRILLION = 1000 * BILLION;

    static final String PUBLIC_PENSION = "public_pension";
    static final String SOVEREIGN_WEALTH = "sovereign_wealth";
    static final String ENDOWMENT = "endowment";
    static final String FOUNDATION = "foundation";

    private static final Set<String> INSTITUTIONAL_FILERS = Set.of(PUBLIC_PENSION, SOVEREIGN_WEALTH, ENDOWMENT);
    private static final List<String> NEWSWORTHY_NAME_TERMS =
            List.of("investment", "capital", "partners", "ventures", "fund");
    private static final List<String> PUBLIC_SITE_TERMS =
            List.of(".gov", ".edu", "pension", "retirement", "foundation");

    private DefaultPlanningRules() {
    }

    public static List<PlanningRule> all() {
        return List.of(
                DefaultPlanningRules::sec13f,
                DefaultPlanningRules::registryLookup,
                DefaultPlanningRules::annualReport,
                DefaultPlanningRules::website,
                DefaultPlanningRules::news,
                DefaultPlanningRules::reverseSearch
        );
    }

    /**
     * 13F holdings filings exist for managers above $100M and for the large institutional
     * allocators; registered family offices file too.
     */
    static Optional<PlannedStrategy> sec13f(EntityProfile profile) {
        double aum = profile.number(EntityFields.AUM).orElse(0.0);
        String lpType = lpType(profile);
        boolean registeredFamilyOffice = profile.entityType() == EntityType.FAMILY_OFFICE
                && profile.has(EntityFields.CRD_NUMBER);

        if (aum < HUNDRED_MILLION && !INSTITUTIONAL_FILERS.contains(lpType) && !registeredFamilyOffice) {
            return Optional.empty();
        }
        int priority = 7;
        if (aum >= TRILLION) {
            priority = 10;
        } else if (aum >= HUNDRED_BILLION) {
            priority = 9;
        } else if (aum >= TEN_BILLION) {
            priority = 8;
        }
        String why = aum >= HUNDRED_MILLION
                ? "AUM of " + formatAum(aum) + " requires 13F filings"
                : registeredFamilyOffice ? "Registered family office with CRD number"
                : "Institutional allocator type " + lpType + " files holdings";
        return Optional.of(new PlannedStrategy(StrategyKind.SEC_13F, priority, 0.9, why));
    }

    static Optional<PlannedStrategy> registryLookup(EntityProfile profile) {
        return EntityFields.IDENTIFIERS.stream()
                .filter(profile::has)
                .sorted()
                .findFirst()
                .map(field -> new PlannedStrategy(StrategyKind.REGISTRY_LOOKUP, 9, 0.85,
                        "Structured identifier " + field + " is known"));
    }

    static Optional<PlannedStrategy> annualReport(EntityProfile profile) {
        String lpType = lpType(profile);
        if (PUBLIC_PENSION.equals(lpType)) {
            return Optional.of(new PlannedStrategy(StrategyKind.ANNUAL_REPORT, 10, 0.85,
                    "Public pensions publish annual reports with allocations"));
        }
        if (ENDOWMENT.equals(lpType)) {
            return Optional.of(new PlannedStrategy(StrategyKind.ANNUAL_REPORT, 8, 0.8,
                    "Endowments publish annual financial reports"));
        }
        if (FOUNDATION.equals(lpType)) {
            return Optional.of(new PlannedStrategy(StrategyKind.ANNUAL_REPORT, 6, 0.7,
                    "Foundations publish annual reports"));
        }
        String website = profile.text(EntityFields.WEBSITE).orElse("").toLowerCase(Locale.ROOT);
        if (PUBLIC_SITE_TERMS.stream().anyMatch(website::contains)) {
            return Optional.of(new PlannedStrategy(StrategyKind.ANNUAL_REPORT, 6, 0.6,
                    "Website suggests a public institution with published reports"));
        }
        return Optional.empty();
    }

    static Optional<PlannedStrategy> website(EntityProfile profile) {
        Optional<String> url = profile.text(EntityFields.WEBSITE).filter(DefaultPlanningRules::isHttpUrl);
        if (url.isEmpty()) {
            return Optional.empty();
        }
        int priority = 6;
        if (profile.entityType() == EntityType.FAMILY_OFFICE) {
            priority = 5;
        } else if (PUBLIC_PENSION.equals(lpType(profile))) {
            priority = 8;
        }
        return Optional.of(new PlannedStrategy(StrategyKind.WEBSITE, priority, 0.7,
                "Website " + url.get() + " can be scraped for first-party facts"));
    }

    static Optional<PlannedStrategy> news(EntityProfile profile) {
        boolean familyOffice = profile.entityType() == EntityType.FAMILY_OFFICE;
        double aum = profile.number(EntityFields.AUM).orElse(0.0);
        String name = profile.targetIdentity().toLowerCase(Locale.ROOT);
        boolean newsworthyName = NEWSWORTHY_NAME_TERMS.stream().anyMatch(name::contains);

        if (!familyOffice && aum < BILLION && !newsworthyName) {
            return Optional.empty();
        }
        int priority = 6;
        if (familyOffice) {
            priority = 8;
        } else if (PUBLIC_PENSION.equals(lpType(profile))) {
            priority = 5;
        }
        String why = familyOffice ? "Family offices are mostly covered by press"
                : aum >= BILLION ? "Large allocator likely covered by press"
                : "Name suggests an investment firm covered by press";
        return Optional.of(new PlannedStrategy(StrategyKind.NEWS, priority, 0.5, why));
    }

    static Optional<PlannedStrategy> reverseSearch(EntityProfile profile) {
        double aum = profile.number(EntityFields.AUM).orElse(0.0);
        int priority = profile.entityType() == EntityType.FAMILY_OFFICE || aum >= TEN_BILLION ? 7 : 6;
        return Optional.of(new PlannedStrategy(StrategyKind.REVERSE_SEARCH, priority, 0.4,
                "Reverse search over portfolio disclosures applies to every target"));
    }

    static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme();
            return scheme != null
                    && (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static String lpType(EntityProfile profile) {
        return profile.text(EntityFields.LP_TYPE).map(s -> s.toLowerCase(Locale.ROOT)).orElse("");
    }

    private static String formatAum(double aum) {
        if (aum >= BILLION) {
            return String.format(Locale.ROOT, "$%.1fB", aum / BILLION);
        }
        return String.format(Locale.ROOT, "$%.0fM", aum / 1_000_000d);
    }
}
