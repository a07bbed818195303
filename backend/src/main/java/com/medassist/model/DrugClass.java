package com.medassist.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Drug classes recognised in guideline content and medication records.
 *
 * Detection is keyword based: whole-word class names and abbreviations,
 * common generic names, and the INN stems "-pril" and "-sartan".
 */
public enum DrugClass {
    ACE_INHIBITOR("ACE inhibitor",
        List.of("acei", "aceis", "ace inhibitor", "ace inhibitors", "ace-inhibitor", "ace-inhibitors",
            "angiotensin-converting enzyme inhibitor", "angiotensin-converting enzyme inhibitors",
            "angiotensin converting enzyme inhibitor", "angiotensin converting enzyme inhibitors"), "pril"),
    ANGIOTENSIN_RECEPTOR_BLOCKER("angiotensin receptor blocker",
        List.of("arb", "arbs", "angiotensin receptor blocker", "angiotensin receptor blockers",
            "angiotensin ii receptor blocker", "angiotensin ii receptor blockers",
            "angiotensin receptor antagonist", "angiotensin receptor antagonists",
            "angiotensin ii receptor antagonist", "angiotensin ii receptor antagonists"), "sartan"),
    CALCIUM_CHANNEL_BLOCKER("calcium channel blocker",
        List.of("ccb", "ccbs", "calcium channel blocker", "calcium channel blockers",
            "amlodipine", "nifedipine", "felodipine", "nicardipine"), null),
    NON_DIHYDROPYRIDINE_CCB("non-dihydropyridine calcium channel blocker", List.of("verapamil", "diltiazem"), null),
    THIAZIDE_DIURETIC("thiazide diuretic",
        List.of("thiazide", "diuretic", "diuretics", "hydrochlorothiazide", "indapamide", "chlorthalidone"), null),
    POTASSIUM_SPARING_DIURETIC("potassium-sparing diuretic",
        List.of("potassium-sparing diuretic", "spironolactone", "amiloride", "eplerenone"), null),
    BETA_BLOCKER("beta blocker",
        List.of("beta blocker", "beta blockers", "beta-blocker", "beta-blockers", "metoprolol", "bisoprolol", "atenolol"), null),
    METHYLDOPA_CLASS("central alpha-2 agonist", List.of("methyldopa"), null),
    LABETALOL_CLASS("alpha-beta blocker", List.of("labetalol"), null),
    BIGUANIDE("biguanide", List.of("biguanide", "metformin"), null),
    INSULIN("insulin", List.of("insulin", "basal insulin", "insulin glargine", "insulin aspart"), null),
    SULFONYLUREA("insulin secretagogue",
        List.of("sulfonylurea", "insulin secretagogue", "gliclazide", "glimepiride", "glipizide"), null),
    DPP4_INHIBITOR("DPP-4 inhibitor", List.of("dpp-4", "dpp4", "dpp-4 inhibitor", "sitagliptin", "linagliptin"), null),
    SGLT2_INHIBITOR("SGLT-2 inhibitor", List.of("sglt-2", "sglt2", "dapagliflozin", "empagliflozin"), null),
    GLP1_AGONIST("GLP-1 receptor agonist", List.of("glp-1", "glp1", "liraglutide", "semaglutide"), null),
    STATIN("statin", List.of("statin", "statins", "atorvastatin", "rosuvastatin", "simvastatin"), null),
    ANTIPLATELET("antiplatelet", List.of("antiplatelet", "aspirin", "clopidogrel"), null),
    IV_ANTIHYPERTENSIVE("intravenous antihypertensive",
        List.of("intravenous antihypertensive", "intravenous blood pressure lowering", "urapidil", "nitroprusside"), null),
    OTHER("other", List.of(), null);

    private final String label;
    private final List<String> keywords;
    private final String stem;

    DrugClass(String label, List<String> keywords, String stem) {
        this.label = label;
        this.keywords = keywords;
        this.stem = stem;
    }

    public String getLabel() {
        return label;
    }

    /**
     * All classes mentioned in free text. "ACEI/ARB" yields both classes.
     */
    public static Set<DrugClass> detect(String text) {
        EnumSet<DrugClass> found = EnumSet.noneOf(DrugClass.class);
        if (text == null || text.isBlank()) {
            return found;
        }
        String padded = (" " + text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\-]+", " ") + " ")
            .replace(" insulin secretagogue", " sulfonylurea");
        String[] tokens = padded.trim().split(" ");
        for (DrugClass drugClass : values()) {
            for (String keyword : drugClass.keywords) {
                if (padded.contains(" " + keyword + " ")) {
                    found.add(drugClass);
                    break;
                }
            }
            if (drugClass.stem != null) {
                for (String token : tokens) {
                    if (token.length() > drugClass.stem.length() + 2 && token.endsWith(drugClass.stem)) {
                        found.add(drugClass);
                        break;
                    }
                }
            }
        }
        return found;
    }

    /**
     * Class of a single medication record; drug name wins over the recorded class column
     * only when the column is empty or unrecognised.
     */
    public static DrugClass classify(String recordedClass, String drugName) {
        Set<DrugClass> fromClass = detect(recordedClass);
        if (fromClass.size() == 1) {
            return fromClass.iterator().next();
        }
        Set<DrugClass> fromName = detect(drugName);
        if (fromName.size() == 1) {
            return fromName.iterator().next();
        }
        return OTHER;
    }
}
