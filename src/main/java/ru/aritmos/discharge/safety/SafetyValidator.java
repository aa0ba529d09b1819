package ru.aritmos.discharge.safety;

import jakarta.inject.Singleton;
import ru.aritmos.discharge.clinical.ClinicalContext;
import ru.aritmos.discharge.clinical.ClinicalModels;
import ru.aritmos.discharge.config.DischargeProperties;
import ru.aritmos.discharge.generation.QaDocument;
import ru.aritmos.discharge.instructions.InstructionModels;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Проверки безопасности сгенерированного содержимого.
 * <p>
 * Порядок проверок:
 * <ol>
 *   <li>каждый названный препарат (в графике приёма, в списке упомянутых препаратов или препарат из словаря,
 *   рекомендованный в тексте) должен присутствовать в текущих назначениях или назначениях при выписке;</li>
 *   <li>противоречие зарегистрированной аллергии (прямо или через перекрёстно-реактивный класс) блокирует результат;</li>
 *   <li>пустой раздел тревожных симптомов для записи тяжести не ниже порога;</li>
 *   <li>ответ вне данных пациента помечается, но не блокируется.</li>
 * </ol>
 * Дополнительно помечаются опасные формулировки и гарантии результата. Блокировка используется только
 * для аллергических противоречий.
 */
@Singleton
public class SafetyValidator {

    /**
     * Аллерген (подстрока) -> препараты, которые с ним перекрёстно реагируют.
     */
    static final Map<String, Set<String>> CROSS_REACTIVITY = buildCrossReactivity();

    /**
     * Препараты, которые распознаются в свободном тексте.
     */
    static final Set<String> LEXICON = buildLexicon();

    private static final List<String> DANGEROUS_PHRASES = List.of(
            "stop taking your medication",
            "stop taking your medications",
            "stop taking all medication",
            "ignore symptoms",
            "ignore the symptoms",
            "ignore your symptoms",
            "don't see a doctor",
            "do not see a doctor",
            "no need to see a doctor",
            "avoid medical care",
            "don't call 911",
            "do not call 911",
            "double your dose",
            "double the dose"
    );

    private static final List<String> OVERCONFIDENT_CLAIMS = List.of(
            "guaranteed to work",
            "guaranteed cure",
            "100% safe",
            "100% effective",
            "completely safe",
            "always works",
            "never fails",
            "no side effects",
            "definitely cure",
            "will definitely"
    );

    private static final Pattern SENTENCE_SPLIT = Pattern.compile("(?<=[.!?;\\n])\\s*");
    private static final int CUE_WINDOW_WORDS = 6;
    /** Отрицание, относящееся к следующему за ним препарату. */
    private static final Pattern GOVERNING_CUE = Pattern.compile(
            "(?i)\\b(avoid\\w*|allerg\\w*|contraindicated|instead of|in place of|stop(?:ped)? taking|"
                    + "(?:do not|don't|does not|doesn't|never|not|cannot|can't|should not|shouldn't|must not|mustn't)"
                    + " (?:take|use|start|restart|receive|be given|give)\\w*)\\b");
    /** Отрицание после препарата: "amoxicillin is contraindicated", "amoxicillin should be avoided". */
    private static final Pattern TRAILING_CUE = Pattern.compile(
            "(?i)^[\\s-]*(?:[\\w-]+\\s+){0,3}?(?:(?:is|are)\\s+(?:contraindicated|not safe|unsafe|not recommended)"
                    + "|(?:should|must)\\s+(?:be avoided|not be (?:taken|used|given)))\\b");
    /** Глагол действия между отрицанием и препаратом разрывает связь: "avoid alcohol, take amoxicillin". */
    private static final Pattern ACTION = Pattern.compile(
            "(?i)\\b(take|takes|taking|use|using|start|starting|continue|continuing|try|trying|give|"
                    + "miss\\w*|skip\\w*|forget\\w*|finish\\w*|complete\\w*)\\b");
    private static final Set<String> DOSE_WORDS = Set.of(
            "mg", "mcg", "ml", "g", "tablet", "tablets", "tab", "tabs", "capsule", "capsules",
            "oral", "daily", "po", "iv", "er", "xr", "sr", "dr", "hcl", "sodium", "units", "unit"
    );

    private final ClinicalModels.Severity warningSignsThreshold;

    public SafetyValidator(DischargeProperties properties) {
        this.warningSignsThreshold = ClinicalModels.Severity.parse(properties.getSafety().getWarningSignsSeverityThreshold());
    }

    /**
     * Проверить документ инструкций (до регидратации).
     */
    public SafetyVerdict validateInstructions(InstructionModels.InstructionDocument document, ClinicalContext context) {
        List<SafetyVerdict.Finding> findings = new ArrayList<>();
        List<String> named = new ArrayList<>();
        for (InstructionModels.MedicationEntry m : document.medicationSchedule()) {
            if (m.name() != null && !m.name().isBlank()) {
                named.add(m.name());
            }
        }

        checkKnownMedications(named, document.allText(), context, findings);
        checkAllergies(named, document.allText(), context, findings);

        if (context.effectiveSeverity().atLeast(warningSignsThreshold) && document.warningSigns().isEmpty()) {
            findings.add(new SafetyVerdict.Finding(SafetyFlag.MISSING_DISCLAIMER,
                    "нет тревожных симптомов для записи тяжести " + context.effectiveSeverity().name().toLowerCase(Locale.ROOT),
                    false));
        }

        checkPhrasing(document.allText(), findings);
        return SafetyVerdict.of(findings);
    }

    /**
     * Проверить ответ на вопрос (до регидратации).
     */
    public SafetyVerdict validateAnswer(QaDocument answer, ClinicalContext context) {
        List<SafetyVerdict.Finding> findings = new ArrayList<>();

        checkKnownMedications(answer.medicationsMentioned(), answer.answer(), context, findings);
        checkAllergies(answer.medicationsMentioned(), answer.answer(), context, findings);

        if (!answer.inScope()) {
            findings.add(new SafetyVerdict.Finding(SafetyFlag.OUT_OF_SCOPE_REQUEST,
                    "вопрос выходит за рамки данных пациента", false));
        }

        checkPhrasing(answer.answer(), findings);
        return SafetyVerdict.of(findings);
    }

    private static void checkKnownMedications(List<String> named, String freeText, ClinicalContext context,
                                              List<SafetyVerdict.Finding> findings) {
        List<Set<String>> known = new ArrayList<>();
        for (ClinicalModels.Medication m : context.knownMedications()) {
            Set<String> t = medicationTokens(m.name());
            if (!t.isEmpty()) {
                known.add(t);
            }
        }
        Set<String> reported = new LinkedHashSet<>();
        for (String name : named) {
            Set<String> tokens = medicationTokens(name);
            if (tokens.isEmpty()) {
                continue;
            }
            if (!traceable(tokens, known) && reported.add(String.join(" ", tokens))) {
                findings.add(new SafetyVerdict.Finding(SafetyFlag.POSSIBLE_HALLUCINATION,
                        "препарат отсутствует в назначениях пациента: " + name.trim(), false));
            }
        }
        if (freeText == null || freeText.isBlank()) {
            return;
        }
        for (String drug : LEXICON) {
            Set<String> tokens = medicationTokens(drug);
            if (traceable(tokens, known) || !affirmativelyMentioned(freeText, drug)) {
                continue;
            }
            if (reported.add(String.join(" ", tokens))) {
                findings.add(new SafetyVerdict.Finding(SafetyFlag.POSSIBLE_HALLUCINATION,
                        "препарат из текста отсутствует в назначениях пациента: " + drug, false));
            }
        }
    }

    private static boolean traceable(Set<String> tokens, List<Set<String>> known) {
        return known.stream().anyMatch(k -> tokens.containsAll(k) || k.containsAll(tokens));
    }

    private static void checkAllergies(List<String> named, String freeText, ClinicalContext context,
                                       List<SafetyVerdict.Finding> findings) {
        for (ClinicalModels.Allergy allergy : context.allergies()) {
            Set<String> terms = contraindicatedTerms(allergy.allergen());
            if (terms.isEmpty()) {
                continue;
            }
            String hit = null;
            for (String name : named) {
                String lower = name.toLowerCase(Locale.ROOT);
                for (String term : terms) {
                    if (containsWord(lower, term)) {
                        hit = name.trim();
                        break;
                    }
                }
                if (hit != null) {
                    break;
                }
            }
            if (hit == null && freeText != null) {
                hit = affirmativeMention(freeText, terms);
            }
            if (hit != null) {
                findings.add(new SafetyVerdict.Finding(SafetyFlag.CONTRAINDICATED_ADVICE,
                        "упоминание '" + hit + "' противоречит аллергии на " + allergy.allergen().trim(), true));
            }
        }
    }

    /**
     * Найти упоминание противопоказанного препарата, которое не является предупреждением.
     */
    private static String affirmativeMention(String text, Set<String> terms) {
        for (String term : terms) {
            if (affirmativelyMentioned(text, term)) {
                return term;
            }
        }
        return null;
    }

    /**
     * Есть ли в тексте упоминание термина, к которому не относится отрицание ("avoid", "do not take",
     * "allergic to" перед термином или "is contraindicated" после него).
     */
    static boolean affirmativelyMentioned(String text, String term) {
        if (text == null) {
            return false;
        }
        Pattern word = wordPattern(term);
        for (String sentence : SENTENCE_SPLIT.split(text)) {
            String lower = sentence.toLowerCase(Locale.ROOT);
            Matcher m = word.matcher(lower);
            while (m.find()) {
                if (!governedByNegation(lower, m.start(), m.end())) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean governedByNegation(String sentence, int termStart, int termEnd) {
        String window = lastWords(sentence.substring(0, termStart), CUE_WINDOW_WORDS);
        Matcher cue = GOVERNING_CUE.matcher(window);
        int cueEnd = -1;
        while (cue.find()) {
            cueEnd = cue.end();
        }
        if (cueEnd >= 0 && !ACTION.matcher(window.substring(cueEnd)).find()) {
            return true;
        }
        return TRAILING_CUE.matcher(sentence.substring(termEnd)).find();
    }

    private static String lastWords(String text, int count) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        String[] words = trimmed.split("\\s+");
        return String.join(" ", Arrays.asList(words).subList(Math.max(0, words.length - count), words.length));
    }

    private static void checkPhrasing(String text, List<SafetyVerdict.Finding> findings) {
        if (text == null || text.isBlank()) {
            return;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String phrase : DANGEROUS_PHRASES) {
            if (lower.contains(phrase)) {
                findings.add(new SafetyVerdict.Finding(SafetyFlag.CONTRAINDICATED_ADVICE,
                        "опасная формулировка: " + phrase, false));
            }
        }
        for (String claim : OVERCONFIDENT_CLAIMS) {
            if (lower.contains(claim)) {
                findings.add(new SafetyVerdict.Finding(SafetyFlag.POSSIBLE_HALLUCINATION,
                        "чрезмерно уверенное утверждение: " + claim, false));
            }
        }
    }

    static Set<String> contraindicatedTerms(String allergen) {
        Set<String> out = new LinkedHashSet<>();
        if (allergen == null || allergen.isBlank()) {
            return out;
        }
        String a = allergen.trim().toLowerCase(Locale.ROOT);
        out.add(a);
        for (Map.Entry<String, Set<String>> e : CROSS_REACTIVITY.entrySet()) {
            if (a.contains(e.getKey())) {
                out.addAll(e.getValue());
            }
        }
        return out;
    }

    /**
     * Нормализованные токены названия препарата (без дозировок и лекарственных форм).
     */
    static Set<String> medicationTokens(String name) {
        Set<String> out = new LinkedHashSet<>();
        if (name == null) {
            return out;
        }
        String cleaned = name.toLowerCase(Locale.ROOT).replaceAll("\\(.*?\\)", " ");
        for (String t : cleaned.split("[^a-z]+")) {
            if (t.length() >= 2 && !DOSE_WORDS.contains(t)) {
                out.add(t);
            }
        }
        return out;
    }

    private static boolean containsWord(String haystack, String word) {
        return wordPattern(word).matcher(haystack).find();
    }

    private static Pattern wordPattern(String word) {
        return Pattern.compile("(?<![a-z])" + Pattern.quote(word) + "(?![a-z])");
    }

    private static Map<String, Set<String>> buildCrossReactivity() {
        Map<String, Set<String>> m = new LinkedHashMap<>();
        m.put("penicillin", Set.of("penicillin", "amoxicillin", "ampicillin", "augmentin", "piperacillin",
                "nafcillin", "oxacillin", "dicloxacillin"));
        m.put("cephalosporin", Set.of("cephalexin", "cefazolin", "ceftriaxone", "cefuroxime", "cefdinir", "cefepime"));
        m.put("sulfa", Set.of("sulfamethoxazole", "bactrim", "sulfasalazine", "sulfadiazine"));
        m.put("nsaid", Set.of("ibuprofen", "naproxen", "diclofenac", "celecoxib", "ketorolac", "aspirin", "meloxicam"));
        m.put("aspirin", Set.of("aspirin", "ibuprofen", "naproxen"));
        m.put("codeine", Set.of("codeine", "morphine", "hydrocodone", "oxycodone"));
        m.put("opioid", Set.of("codeine", "morphine", "hydrocodone", "oxycodone", "tramadol", "fentanyl"));
        m.put("macrolide", Set.of("erythromycin", "azithromycin", "clarithromycin"));
        m.put("fluoroquinolone", Set.of("ciprofloxacin", "levofloxacin", "moxifloxacin"));
        m.put("tetracycline", Set.of("tetracycline", "doxycycline", "minocycline"));
        m.put("ace inhibitor", Set.of("lisinopril", "enalapril", "ramipril", "captopril", "benazepril"));
        m.put("statin", Set.of("atorvastatin", "simvastatin", "rosuvastatin", "pravastatin"));
        return m;
    }

    private static Set<String> buildLexicon() {
        Set<String> out = new LinkedHashSet<>();
        CROSS_REACTIVITY.values().forEach(out::addAll);
        return out;
    }
}
