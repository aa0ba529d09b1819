package ru.aritmos.discharge.core;

import java.util.List;

/**
 * Единое исключение ядра Discharge Assist.
 * <p>
 * Каждый отказ несёт {@link ErrorKind}, чтобы вызывающая сторона (UI/API) могла отличить
 * «попробуйте позже» от «у пациента ещё нет данных». Сообщение всегда санитизировано.
 * <p>
 * Важно: ядро никогда не подменяет отказ сфабрикованным содержимым.
 */
public class DischargeAssistException extends RuntimeException {

    /**
     * Таксономия отказов.
     */
    public enum ErrorKind {
        /** Пациент или медицинская запись не найдены. */
        NOT_FOUND(true, false),
        /** Нет записи/выписки, из которой можно синтезировать инструкции. */
        INCOMPLETE_CONTEXT(true, false),
        /** Пустой или некорректный вопрос. */
        INVALID_QUESTION(true, false),
        /** Ответ модели не прошёл строгий разбор. Внутренний вид: после повтора превращается в GENERATION_FAILED. */
        MALFORMED_GENERATION(false, true),
        /** Модель дважды вернула структурно некорректный документ. */
        GENERATION_FAILED(false, true),
        /** Содержимое не прошло блокирующую проверку безопасности после повтора. */
        UNSAFE_GENERATION_BLOCKED(false, false),
        /** Модель недоступна, не сконфигурирована или не ответила вовремя. */
        SERVICE_UNAVAILABLE(false, true);

        private final boolean clientError;
        private final boolean retryable;

        ErrorKind(boolean clientError, boolean retryable) {
            this.clientError = clientError;
            this.retryable = retryable;
        }

        public boolean clientError() {
            return clientError;
        }

        public boolean retryable() {
            return retryable;
        }
    }

    private final ErrorKind kind;
    private final String errorCode;
    private final List<String> details;

    public DischargeAssistException(ErrorKind kind, String errorCode, String message) {
        this(kind, errorCode, message, List.of(), null);
    }

    public DischargeAssistException(ErrorKind kind, String errorCode, String message, Throwable cause) {
        this(kind, errorCode, message, List.of(), cause);
    }

    public DischargeAssistException(ErrorKind kind, String errorCode, String message, List<String> details, Throwable cause) {
        super(SensitiveDataSanitizer.sanitizeText(message), cause);
        this.kind = kind;
        this.errorCode = errorCode == null ? kind.name() : errorCode;
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    public ErrorKind kind() {
        return kind;
    }

    public String errorCode() {
        return errorCode;
    }

    /**
     * Дополнительная диагностика (например, список сработавших флагов безопасности).
     */
    public List<String> details() {
        return details;
    }

    public static DischargeAssistException notFound(String message) {
        return new DischargeAssistException(ErrorKind.NOT_FOUND, "NOT_FOUND", message);
    }

    public static DischargeAssistException incompleteContext(String message) {
        return new DischargeAssistException(ErrorKind.INCOMPLETE_CONTEXT, "INCOMPLETE_CONTEXT", message);
    }

    public static DischargeAssistException invalidQuestion(String message) {
        return new DischargeAssistException(ErrorKind.INVALID_QUESTION, "INVALID_QUESTION", message);
    }

    public static DischargeAssistException generationFailed(String message) {
        return new DischargeAssistException(ErrorKind.GENERATION_FAILED, "GENERATION_FAILED", message);
    }

    public static DischargeAssistException unsafeBlocked(String message, List<String> details) {
        return new DischargeAssistException(ErrorKind.UNSAFE_GENERATION_BLOCKED, "UNSAFE_GENERATION_BLOCKED", message, details, null);
    }

    public static DischargeAssistException serviceUnavailable(String code, String message, Throwable cause) {
        return new DischargeAssistException(ErrorKind.SERVICE_UNAVAILABLE, code, message, cause);
    }
}
