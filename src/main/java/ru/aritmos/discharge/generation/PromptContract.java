package ru.aritmos.discharge.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Singleton;
import ru.aritmos.discharge.config.DischargeProperties;
import ru.aritmos.discharge.instructions.InstructionModels;
import ru.aritmos.discharge.redaction.RedactedContext;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Контракт промптов и схем ответа модели.
 * <p>
 * Формирует запросы для синтеза инструкций и для Q&A и строго разбирает ответы:
 * допускается только одно обрамление markdown-блоком кода вокруг JSON, любые другие отклонения
 * (не JSON, отсутствующие ключи, неверные типы) дают {@link ParsedGeneration#malformed(String)}.
 */
@Singleton
public class PromptContract {

    private static final Pattern CODE_FENCE = Pattern.compile("^```[A-Za-z]*\\s*\\n?(.*?)\\n?\\s*```$", Pattern.DOTALL);

    static final String INSTRUCTIONS_SYSTEM_PROMPT = """
            You are a healthcare assistant that writes personalized, easy-to-understand discharge instructions.

            GUIDELINES:
            1. Use simple, non-medical language that patients and caregivers can understand.
            2. Be specific about medication schedules: exact dosage and timing.
            3. Only mention medications that appear in the patient context. Never suggest a medication the patient is allergic to.
            4. Always include specific warning signs that require immediate medical attention.
            5. Placeholder tokens such as PATIENT_NAME, CONTACT_1, CLINICIAN_1, PHONE_1 stand for real values. Copy them exactly; never invent names, phone numbers or contacts.
            6. Never tell the patient to stop medication or to ignore symptoms. Never promise guaranteed outcomes.

            Respond with ONE JSON object and nothing else, with exactly these keys:
            - "medication_schedule": array of {"name": string, "dosage": string, "timing": string, "instructions": string}
            - "lifestyle_recommendations": array of strings
            - "follow_up_reminders": array of {"purpose": string, "timeframe": string, "provider": string}
            - "warning_signs": array of strings
            - "activity_guidelines": array of strings
            - "diet_recommendations": array of strings
            - "wound_care_instructions": array of strings (empty array if not applicable)
            - "emergency_contacts": array of {"name": string, "relationship": string, "phone": string, "when_to_call": string}
            - "summary": string
            """;

    static final String QA_SYSTEM_PROMPT = """
            You are a careful healthcare assistant answering a patient's follow-up question about their own care.

            SAFETY RULES:
            1. Answer ONLY from the de-identified patient context provided. If the context does not contain the answer, say so and set "in_scope" to false.
            2. Never recommend starting, stopping or changing a medication or dose. Refer such decisions to the care team.
            3. Never tell the patient to ignore symptoms. For anything that sounds like an emergency, tell them to call emergency services.
            4. Never promise guaranteed results or claim anything is 100% safe.
            5. Placeholder tokens such as PATIENT_NAME or CLINICIAN_1 stand for real values. Copy them exactly.

            Respond with ONE JSON object and nothing else, with exactly these keys:
            - "answer": string
            - "confidence": number between 0 and 1
            - "sources": array of context section names you used, chosen from "available_sections"
            - "medications_mentioned": array of medication names mentioned in the answer
            - "in_scope": boolean
            - "related_topics": array of strings
            """;

    private final ObjectMapper objectMapper;
    private final DischargeProperties.Model modelConfig;

    public PromptContract(ObjectMapper objectMapper, DischargeProperties properties) {
        this.objectMapper = objectMapper;
        this.modelConfig = properties.getModel();
    }

    /**
     * Запрос на синтез инструкций.
     */
    public GenerationRequest instructionsRequest(RedactedContext context) {
        String user = "Patient context (de-identified JSON):\n"
                + toJson(context)
                + "\n\nCreate detailed, patient-friendly discharge instructions that address all aspects of this patient's care and recovery.";
        return new GenerationRequest(
                GenerationRequest.Operation.INSTRUCTIONS,
                INSTRUCTIONS_SYSTEM_PROMPT,
                user,
                modelConfig.getInstructionsTemperature(),
                modelConfig.getInstructionsMaxTokens());
    }

    /**
     * Запрос на ответ по вопросу. Вопрос должен быть уже отредактирован.
     */
    public GenerationRequest questionRequest(RedactedContext context, String redactedQuestion) {
        String user = "Patient context (de-identified JSON):\n"
                + toJson(context)
                + "\n\nPatient question:\n" + redactedQuestion;
        return new GenerationRequest(
                GenerationRequest.Operation.QUESTION,
                QA_SYSTEM_PROMPT,
                user,
                modelConfig.getQaTemperature(),
                modelConfig.getQaMaxTokens());
    }

    /**
     * Корректирующая инструкция для повтора после некорректного ответа.
     */
    public static String correctiveInstruction(String reason) {
        return "Your previous response could not be used (" + reason + "). "
                + "Respond again with ONE valid JSON object containing exactly the required keys with the required types. "
                + "Do not add any text before or after the JSON.";
    }

    /**
     * Усиленные ограничения безопасности для повтора после блокировки.
     */
    public static String safetyReinforcement(List<String> findings) {
        return "Your previous response was rejected by the safety review: " + String.join("; ", findings) + ". "
                + "Do NOT mention or recommend any medication the patient is allergic to, or any drug of the same class. "
                + "Mention only medications listed in the patient context.";
    }

    /**
     * Строгий разбор документа инструкций.
     */
    public ParsedGeneration<InstructionModels.InstructionDocument> parseInstructions(String raw) {
        JsonNode root;
        try {
            root = readObject(raw);
        } catch (MalformedException e) {
            return ParsedGeneration.malformed(e.getMessage());
        }
        try {
            List<InstructionModels.MedicationEntry> meds = new ArrayList<>();
            for (JsonNode n : requireArray(root, "medication_schedule")) {
                requireObject(n, "medication_schedule[]");
                meds.add(new InstructionModels.MedicationEntry(
                        optString(n, "name"),
                        optString(n, "dosage"),
                        optString(n, "timing"),
                        optString(n, "instructions")));
            }
            List<InstructionModels.FollowUpReminder> reminders = new ArrayList<>();
            for (JsonNode n : requireArray(root, "follow_up_reminders")) {
                requireObject(n, "follow_up_reminders[]");
                reminders.add(new InstructionModels.FollowUpReminder(
                        optString(n, "purpose"),
                        optString(n, "timeframe"),
                        optString(n, "provider")));
            }
            List<InstructionModels.EmergencyContactEntry> contacts = new ArrayList<>();
            for (JsonNode n : requireArray(root, "emergency_contacts")) {
                requireObject(n, "emergency_contacts[]");
                contacts.add(new InstructionModels.EmergencyContactEntry(
                        optString(n, "name"),
                        optString(n, "relationship"),
                        optString(n, "phone"),
                        optString(n, "when_to_call")));
            }
            List<String> wound = root.has("wound_care_instructions") && !root.get("wound_care_instructions").isNull()
                    ? stringArray(root, "wound_care_instructions")
                    : List.of();
            JsonNode summary = root.get("summary");
            if (summary == null || !summary.isTextual()) {
                throw new MalformedException("summary: ожидается строка");
            }
            return ParsedGeneration.valid(new InstructionModels.InstructionDocument(
                    meds,
                    stringArray(root, "lifestyle_recommendations"),
                    reminders,
                    stringArray(root, "warning_signs"),
                    stringArray(root, "activity_guidelines"),
                    stringArray(root, "diet_recommendations"),
                    wound,
                    contacts,
                    summary.asText()));
        } catch (MalformedException e) {
            return ParsedGeneration.malformed(e.getMessage());
        }
    }

    /**
     * Строгий разбор ответа на вопрос.
     */
    public ParsedGeneration<QaDocument> parseAnswer(String raw) {
        try {
            JsonNode root = readObject(raw);
            JsonNode answer = root.get("answer");
            if (answer == null || !answer.isTextual() || answer.asText().isBlank()) {
                throw new MalformedException("answer: ожидается непустая строка");
            }
            JsonNode confidence = root.get("confidence");
            if (confidence == null || !confidence.isNumber()) {
                throw new MalformedException("confidence: ожидается число");
            }
            double c = confidence.asDouble();
            if (Double.isNaN(c) || c < 0.0 || c > 1.0) {
                throw new MalformedException("confidence: значение вне диапазона [0,1]");
            }
            JsonNode inScope = root.get("in_scope");
            if (inScope == null || !inScope.isBoolean()) {
                throw new MalformedException("in_scope: ожидается boolean");
            }
            return ParsedGeneration.valid(new QaDocument(
                    answer.asText(),
                    c,
                    stringArray(root, "sources"),
                    stringArray(root, "medications_mentioned"),
                    inScope.asBoolean(),
                    stringArray(root, "related_topics")));
        } catch (MalformedException e) {
            return ParsedGeneration.malformed(e.getMessage());
        }
    }

    private String toJson(RedactedContext context) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(context.projection());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Не удалось сериализовать контекст для промпта", e);
        }
    }

    private JsonNode readObject(String raw) throws MalformedException {
        if (raw == null || raw.isBlank()) {
            throw new MalformedException("пустой ответ");
        }
        String text = raw.trim();
        if (text.startsWith("```")) {
            Matcher m = CODE_FENCE.matcher(text);
            if (!m.matches()) {
                throw new MalformedException("незакрытый блок кода");
            }
            text = m.group(1).trim();
        }
        JsonNode root;
        try {
            root = objectMapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(text);
        } catch (JsonProcessingException e) {
            throw new MalformedException("ответ не является JSON");
        }
        if (root == null || !root.isObject()) {
            throw new MalformedException("ожидается JSON-объект");
        }
        return root;
    }

    private static Iterable<JsonNode> requireArray(JsonNode root, String field) throws MalformedException {
        JsonNode n = root.get(field);
        if (n == null || !n.isArray()) {
            throw new MalformedException(field + ": ожидается массив");
        }
        return n;
    }

    private static void requireObject(JsonNode n, String path) throws MalformedException {
        if (!n.isObject()) {
            throw new MalformedException(path + ": ожидается объект");
        }
        Iterator<Map.Entry<String, JsonNode>> it = n.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode v = e.getValue();
            if (!v.isNull() && !v.isTextual()) {
                throw new MalformedException(path + "." + e.getKey() + ": ожидается строка");
            }
        }
    }

    private static String optString(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static List<String> stringArray(JsonNode root, String field) throws MalformedException {
        List<String> out = new ArrayList<>();
        for (JsonNode n : requireArray(root, field)) {
            if (!n.isTextual()) {
                throw new MalformedException(field + "[]: ожидается строка");
            }
            out.add(n.asText());
        }
        return out;
    }

    /**
     * Внутренний сигнал некорректного ответа.
     */
    private static final class MalformedException extends Exception {
        MalformedException(String message) {
            super(message);
        }
    }
}
