package ru.aritmos.discharge.redaction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Singleton;
import ru.aritmos.discharge.clinical.ClinicalContext;
import ru.aritmos.discharge.clinical.ClinicalModels;
import ru.aritmos.discharge.clinical.ContextSection;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Слой редактирования ПДн.
 * <p>
 * Строит модельную проекцию контекста ({@link #redact(ClinicalContext)}), в которой имена, телефоны,
 * email, адреса и идентификаторы заменены детерминированными токенами, и возвращает исходные значения
 * в сгенерированный текст ({@link #rehydrate(String, RedactionMapping)}).
 * <p>
 * Регидратация подставляет только токены из соответствия запроса, поэтому в итоговый текст не может
 * попасть значение, которого не было в контексте.
 */
@Singleton
public class PiiRedactor {

    public static final String PATIENT_NAME = "PATIENT_NAME";

    private static final String NAME_BOUNDARY_LEFT = "(?<![\\p{L}\\p{N}_])";
    private static final String NAME_BOUNDARY_RIGHT = "(?![\\p{L}\\p{N}_])";

    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern SSN = Pattern.compile("(?<!\\d)\\d{3}-\\d{2}-\\d{4}(?!\\d)");
    private static final Pattern PHONE = Pattern.compile(
            "(?<![\\d\\w])(?:\\+?1[-. ]?)?(?:\\(\\d{3}\\)|\\d{3})[-. ]?\\d{3}[-. ]?\\d{4}(?!\\d)");
    private static final Pattern STREET_ADDRESS = Pattern.compile(
            "(?<!\\d)\\d{1,5}\\s+(?:[A-Z][A-Za-z]*\\.?\\s+){1,4}"
                    + "(?:Street|St|Avenue|Ave|Road|Rd|Boulevard|Blvd|Lane|Ln|Drive|Dr|Court|Ct|Way|Place|Pl)\\b\\.?"
                    + "(?:,?\\s*(?:Apt|Suite|Unit)\\.?\\s*\\w+)?");

    private static final Pattern TOKEN = Pattern.compile(
            "[\\[{<]?\\b(PATIENT_NAME|CONTACT_\\d+_PHONE|CONTACT_\\d+_EMAIL|CONTACT_\\d+|CLINICIAN_\\d+|PHONE_\\d+|EMAIL_\\d+|ID_\\d+|ADDRESS_\\d+)\\b[\\]}>]?");

    private final ObjectMapper objectMapper;

    public PiiRedactor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Построить модельную проекцию контекста.
     *
     * @param context клинический контекст запроса
     * @return проекция без ПДн и соответствие токенов
     */
    public RedactedContext redact(ClinicalContext context) {
        RedactionMapping mapping = registerIdentity(context.identity());

        ObjectNode root = objectMapper.createObjectNode();
        root.put("context_mode", context.mode().name().toLowerCase(Locale.ROOT));

        ObjectNode patient = root.putObject("patient");
        patient.put("name", PATIENT_NAME);
        patient.put("age_group", context.ageGroup());
        patient.put("sex", context.sex());
        stringArray(patient.putArray("medical_history"), context.medicalHistory(), mapping);
        ArrayNode allergies = patient.putArray("allergies");
        for (ClinicalModels.Allergy a : context.allergies()) {
            ObjectNode n = allergies.addObject();
            n.put("allergen", redactText(a.allergen(), mapping));
            n.put("reaction", redactText(a.reaction(), mapping));
            n.put("severity", a.severity());
        }
        medications(patient.putArray("current_medications"), context.currentMedications(), mapping);
        ClinicalModels.EmergencyContact ec = context.identity() == null ? null : context.identity().emergencyContact();
        if (ec != null && ec.name() != null && !ec.name().isBlank()) {
            ObjectNode n = patient.putObject("emergency_contact");
            n.put("name", mapping.tokenFor(ec.name(), "CONTACT"));
            n.put("relationship", ec.relationship());
            if (ec.phone() != null && !ec.phone().isBlank()) {
                n.put("phone", mapping.tokenFor(ec.phone(), "PHONE"));
            }
        }

        ArrayNode records = root.putArray("medical_records");
        for (ClinicalModels.MedicalRecord r : context.medicalRecords()) {
            ObjectNode n = records.addObject();
            n.put("id", r.id());
            n.put("admission_date", iso(r.admissionDate()));
            n.put("discharge_date", iso(r.dischargeDate()));
            n.put("primary_diagnosis", redactText(r.primaryDiagnosis(), mapping));
            stringArray(n.putArray("secondary_diagnoses"), r.secondaryDiagnoses(), mapping);
            stringArray(n.putArray("procedures_performed"), r.proceduresPerformed(), mapping);
            n.put("treatment_summary", redactText(r.treatmentSummary(), mapping));
            n.put("physician_notes", redactText(r.physicianNotes(), mapping));
            n.put("nursing_notes", redactText(r.nursingNotes(), mapping));
            n.put("severity_level", r.severity().name().toLowerCase(Locale.ROOT));
            ArrayNode labs = n.putArray("lab_results");
            for (ClinicalModels.LabResult l : r.labResults()) {
                ObjectNode ln = labs.addObject();
                ln.put("test", redactText(l.testName(), mapping));
                ln.put("value", l.value());
                ln.put("unit", l.unit());
                ln.put("reference_range", l.referenceRange());
                ln.put("status", l.status());
            }
            ArrayNode vitals = n.putArray("vital_signs");
            for (ClinicalModels.VitalSigns v : r.vitalSigns()) {
                ObjectNode vn = vitals.addObject();
                vn.put("temperature", v.temperature());
                if (v.bloodPressureSystolic() != null && v.bloodPressureDiastolic() != null) {
                    vn.put("blood_pressure", v.bloodPressureSystolic() + "/" + v.bloodPressureDiastolic());
                }
                vn.put("heart_rate", v.heartRate());
                vn.put("respiratory_rate", v.respiratoryRate());
                vn.put("oxygen_saturation", v.oxygenSaturation());
                vn.put("recorded_at", iso(v.recordedAt()));
            }
        }

        ArrayNode notes = root.putArray("discharge_notes");
        for (ClinicalModels.DischargeNote d : context.dischargeNotes()) {
            ObjectNode n = notes.addObject();
            n.put("medical_record_id", d.medicalRecordId());
            n.put("discharge_date", iso(d.dischargeDate()));
            n.put("discharge_summary", redactText(d.dischargeSummary(), mapping));
            medications(n.putArray("medications_at_discharge"), d.medicationsAtDischarge(), mapping);
            n.put("follow_up_instructions", redactText(d.followUpInstructions(), mapping));
            n.put("activity_restrictions", redactText(d.activityRestrictions(), mapping));
            n.put("diet_instructions", redactText(d.dietInstructions(), mapping));
            n.put("warning_signs", redactText(d.warningSigns(), mapping));
            n.put("discharge_physician", redactText(d.dischargePhysician(), mapping));
        }

        if (context.mode() == ClinicalContext.Mode.COMPREHENSIVE) {
            ClinicalContext.VisitSummary vs = context.visitSummary();
            if (vs != null) {
                ObjectNode n = root.putObject("visit_summary");
                n.put("total_visits", vs.totalVisits());
                n.put("total_days_in_hospital", vs.totalDaysInHospital());
                n.put("current_status", vs.currentStatus());
                n.put("last_visit_type", vs.lastVisitType());
                n.put("last_visit_date", iso(vs.lastVisitDate()));
            }
            ArrayNode activities = root.putArray("recent_activities");
            for (ClinicalModels.PatientActivity a : context.recentActivities()) {
                ObjectNode n = activities.addObject();
                n.put("type", a.activityType());
                n.put("description", redactText(a.description(), mapping));
                n.put("performed_by", redactText(a.performedBy(), mapping));
                n.put("timestamp", iso(a.timestamp()));
            }
            ArrayNode timeline = root.putArray("timeline");
            for (ClinicalModels.TimelineEvent t : context.timeline()) {
                ObjectNode n = timeline.addObject();
                n.put("event_type", t.eventType());
                n.put("title", redactText(t.eventTitle(), mapping));
                n.put("description", redactText(t.eventDescription(), mapping));
                n.put("date", iso(t.eventDate()));
                n.put("severity", t.severity());
                n.put("category", t.category());
            }
        }

        ArrayNode care = root.putArray("care_team_contacts");
        for (ClinicalContext.CareContact c : context.careTeamContacts()) {
            ObjectNode n = care.addObject();
            n.put("name", c.name());
            n.put("phone", c.phone());
            n.put("role", c.role());
        }

        ArrayNode sections = root.putArray("available_sections");
        for (ContextSection s : context.availableSections()) {
            sections.add(s.wireName());
        }

        return new RedactedContext(context.patientId(), context.mode(), root, mapping);
    }

    /**
     * Соответствие для идентифицирующих данных пациента (имя, контакты, клиницисты) без построения проекции.
     */
    public RedactionMapping mappingFor(ClinicalContext.Identity identity) {
        return registerIdentity(identity);
    }

    /**
     * Отредактировать произвольный текст (например, вопрос пациента) в рамках соответствия запроса.
     * <p>
     * Сначала заменяются известные значения из контекста, затем остаточные шаблоны
     * (email, идентификаторы вида SSN, телефоны, адреса).
     */
    public String redactText(String text, RedactionMapping mapping) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String out = text;
        for (Map.Entry<String, String> known : mapping.knownValuesLongestFirst()) {
            Pattern p = Pattern.compile(NAME_BOUNDARY_LEFT + Pattern.quote(known.getKey()) + NAME_BOUNDARY_RIGHT,
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            out = p.matcher(out).replaceAll(Matcher.quoteReplacement(known.getValue()));
        }
        out = replaceResidual(out, EMAIL, "EMAIL", mapping);
        out = replaceResidual(out, SSN, "ID", mapping);
        out = replaceResidual(out, PHONE, "PHONE", mapping);
        out = replaceResidual(out, STREET_ADDRESS, "ADDRESS", mapping);
        return out;
    }

    /**
     * Вернуть исходные значения вместо токенов.
     * <p>
     * Заменяются только токены, известные соответствию; неизвестные токены остаются как есть.
     */
    public String rehydrate(String text, RedactionMapping mapping) {
        if (text == null || text.isEmpty() || mapping == null || mapping.size() == 0) {
            return text;
        }
        Matcher m = TOKEN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String token = m.group(1);
            String replacement = mapping.originalOf(token).orElse(null);
            if (replacement == null) {
                m.appendReplacement(sb, Matcher.quoteReplacement(m.group()));
            } else {
                m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
            }
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private RedactionMapping registerIdentity(ClinicalContext.Identity identity) {
        RedactionMapping mapping = new RedactionMapping();
        if (identity == null) {
            return mapping;
        }
        String fullName = identity.fullName();
        if (!fullName.isEmpty()) {
            mapping.registerFixed(PATIENT_NAME, fullName);
            mapping.registerAlias(identity.firstName(), PATIENT_NAME);
            mapping.registerAlias(identity.lastName(), PATIENT_NAME);
            if (identity.firstName() != null && identity.lastName() != null) {
                mapping.registerAlias(identity.lastName().trim() + ", " + identity.firstName().trim(), PATIENT_NAME);
            }
        }
        mapping.tokenFor(identity.phone(), "PHONE");
        mapping.tokenFor(identity.email(), "EMAIL");
        mapping.tokenFor(identity.address(), "ADDRESS");

        ClinicalModels.EmergencyContact ec = identity.emergencyContact();
        if (ec != null && ec.name() != null && !ec.name().isBlank()) {
            String contactToken = mapping.tokenFor(ec.name(), "CONTACT");
            if (ec.phone() != null && !ec.phone().isBlank()) {
                mapping.registerFixed(contactToken + "_PHONE", ec.phone());
            }
            if (ec.email() != null && !ec.email().isBlank()) {
                mapping.registerFixed(contactToken + "_EMAIL", ec.email());
            }
        }

        for (String clinician : identity.clinicianNames()) {
            String token = mapping.tokenFor(clinician, "CLINICIAN");
            String bare = stripTitle(clinician);
            if (!bare.equals(clinician.trim())) {
                mapping.registerAlias(bare, token);
            }
        }
        return mapping;
    }

    private static String stripTitle(String name) {
        return name.trim().replaceFirst("(?i)^(dr\\.?|doctor|nurse|rn)\\s+", "");
    }

    private static String replaceResidual(String text, Pattern pattern, String category, RedactionMapping mapping) {
        Matcher m = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String token = mapping.tokenFor(m.group(), category);
            m.appendReplacement(sb, Matcher.quoteReplacement(token));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private void stringArray(ArrayNode target, List<String> values, RedactionMapping mapping) {
        for (String v : values) {
            target.add(redactText(v, mapping));
        }
    }

    private void medications(ArrayNode target, List<ClinicalModels.Medication> meds, RedactionMapping mapping) {
        for (ClinicalModels.Medication m : meds) {
            ObjectNode n = target.addObject();
            n.put("name", m.name());
            n.put("dosage", m.dosage());
            n.put("frequency", m.frequency());
            n.put("route", m.route());
            n.put("instructions", redactText(m.instructions(), mapping));
        }
    }

    private static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
