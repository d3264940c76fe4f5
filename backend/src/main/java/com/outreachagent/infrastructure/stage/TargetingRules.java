package com.outreachagent.infrastructure.stage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule tables driving heuristic enrichment. Persona rules are matched in declaration order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TargetingRules(
        @JsonProperty("company_size_rules") Map<String, String> companySizeRules,
        @JsonProperty("persona_rules") LinkedHashMap<String, String> personaRules,
        @JsonProperty("pain_points") Map<String, List<String>> painPoints,
        @JsonProperty("triggers") Map<String, List<String>> triggers,
        @JsonProperty("default_pains") List<String> defaultPains,
        @JsonProperty("default_triggers") List<String> defaultTriggers,
        @JsonProperty("tier1_countries") List<String> tier1Countries
) {

    public TargetingRules {
        companySizeRules = companySizeRules == null ? Map.of() : companySizeRules;
        personaRules = personaRules == null ? new LinkedHashMap<>() : personaRules;
        painPoints = painPoints == null ? Map.of() : painPoints;
        triggers = triggers == null ? Map.of() : triggers;
        defaultPains = defaultPains == null ? List.of("Operational inefficiency") : defaultPains;
        defaultTriggers = defaultTriggers == null ? List.of("Budget cycle") : defaultTriggers;
        tier1Countries = tier1Countries == null ? List.of("US", "UK", "CA") : tier1Countries;
    }

    public static TargetingRules defaults() {
        LinkedHashMap<String, String> personas = new LinkedHashMap<>();
        personas.put("VP", "Executive");
        personas.put("Head", "Department Head");
        personas.put("Director", "Director");
        personas.put("Manager", "Manager");
        personas.put("Lead", "Team Lead");
        personas.put("CTO", "C-Suite");
        personas.put("CEO", "C-Suite");
        personas.put("CFO", "C-Suite");

        return new TargetingRules(
                Map.of("Software", "SMB",
                        "Manufacturing", "Enterprise",
                        "Retail", "Mid-Market",
                        "Healthcare", "Mid-Market",
                        "Logistics", "Mid-Market"),
                personas,
                Map.of("Software", List.of("Release velocity bottlenecks", "Rising cloud costs", "Technical debt"),
                        "Manufacturing", List.of("Downtime and maintenance", "Supplier risk", "Quality control"),
                        "Retail", List.of("Inventory accuracy", "Cart abandonment", "Customer retention"),
                        "Healthcare", List.of("Staffing shortages", "Compliance overhead", "Patient satisfaction"),
                        "Logistics", List.of("On-time delivery", "Route inefficiency", "Fuel cost management")),
                Map.of("Software", List.of("New product launch", "Security incidents", "Scaling challenges"),
                        "Manufacturing", List.of("Line expansions", "New plant", "Automation initiatives"),
                        "Retail", List.of("Peak season", "New store openings", "E-commerce expansion"),
                        "Healthcare", List.of("Regulatory change", "EHR upgrade", "Facility expansion"),
                        "Logistics", List.of("Fuel spikes", "Network redesign", "Fleet modernization")),
                List.of("Operational inefficiency", "Cost optimization needs"),
                List.of("Budget cycle", "Strategic planning phase"),
                List.of("US", "UK", "CA", "DE", "FR", "AU"));
    }

    public String companySizeFor(String industry) {
        return companySizeRules.getOrDefault(industry, "Mid-Market");
    }

    public boolean isKnownIndustry(String industry) {
        return companySizeRules.containsKey(industry);
    }

    public String personaFor(String title) {
        String lower = title == null ? "" : title.toLowerCase();
        for (Map.Entry<String, String> rule : personaRules.entrySet()) {
            if (lower.contains(rule.getKey().toLowerCase())) {
                return rule.getValue();
            }
        }
        return "Professional";
    }

    public List<String> painsFor(String industry) {
        return painPoints.getOrDefault(industry, defaultPains);
    }

    public List<String> triggersFor(String industry) {
        return triggers.getOrDefault(industry, defaultTriggers);
    }

    public boolean isTier1Country(String country) {
        return tier1Countries.contains(country);
    }
}
