package ru.aritmos.discharge.instructions;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.discharge.config.DischargeProperties;
import ru.aritmos.discharge.core.DischargeAssistException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Коалесцер и кэш генерации инструкций.
 * <p>
 * Гарантии:
 * <ul>
 *   <li>не более одной генерации на ключ одновременно: остальные вызывающие ждут тот же future
 *   и получают тот же результат (тот же объект) или ту же ошибку;</li>
 *   <li>ошибка генерации не оставляет записи в кэше;</li>
 *   <li>запись с другой версией исходных данных не возвращается и заменяется новой генерацией;</li>
 *   <li>разные ключи не блокируют друг друга.</li>
 * </ul>
 */
@Singleton
public class GenerationCoalescer {

    private static final Logger log = LoggerFactory.getLogger(GenerationCoalescer.class);

    /** Обращений к модели за одну генерацию: первая попытка, повтор при некорректном ответе и повтор при блокировке. */
    static final int MAX_MODEL_CALLS = 3;
    static final long WAIT_MARGIN_MS = 5000;

    private final ConcurrentHashMap<GenerationKey, Slot> slots = new ConcurrentHashMap<>();
    private final long waitTimeoutMs;

    @Inject
    public GenerationCoalescer(DischargeProperties properties) {
        this(waitTimeoutFor(properties));
    }

    public GenerationCoalescer(long waitTimeoutMs) {
        this.waitTimeoutMs = Math.max(1, waitTimeoutMs);
    }

    /**
     * Ожидающий не должен сдаться раньше владельца: таймаут ожидания не меньше худшего времени генерации
     * ({@link #MAX_MODEL_CALLS} обращений с таймаутами соединения и запроса) плюс запас.
     */
    static long waitTimeoutFor(DischargeProperties properties) {
        DischargeProperties.Model model = properties.getModel();
        long generationBound = MAX_MODEL_CALLS * (model.getConnectTimeoutMs() + model.getRequestTimeoutMs()) + WAIT_MARGIN_MS;
        long configured = properties.getCache().getWaitTimeoutMs();
        if (configured < generationBound) {
            log.warn("Таймаут ожидания генерации {} мс меньше худшего времени генерации, используется {} мс",
                    configured, generationBound);
            return generationBound;
        }
        return configured;
    }

    /**
     * Вернуть закэшированный результат для текущей версии или выполнить генерацию.
     *
     * @param key ключ (пациент, запись)
     * @param version текущая версия исходных данных
     * @param generator генерация; выполняется в потоке вызывающего, который стал владельцем слота
     * @return результат (для одновременных вызовов один и тот же объект)
     */
    public InstructionModels.PersonalizedInstructions getOrGenerate(GenerationKey key,
                                                                    String version,
                                                                    Supplier<InstructionModels.PersonalizedInstructions> generator) {
        while (true) {
            Slot[] created = new Slot[1];
            Slot slot = slots.compute(key, (k, existing) -> {
                if (existing != null && (existing.version().equals(version) || !existing.future().isDone())) {
                    return existing;
                }
                created[0] = new Slot(version, new CompletableFuture<>(), new AtomicInteger());
                return created[0];
            });

            if (slot == created[0]) {
                return runAsOwner(key, slot, generator);
            }

            if (slot.version().equals(version)) {
                if (slot.future().isDone() && !slot.future().isCompletedExceptionally()) {
                    log.debug("Инструкции взяты из кэша: key={} version={}", key, version);
                }
                return await(key, slot);
            }

            // В работе генерация для другой версии: дождаться её и пересмотреть слот.
            log.debug("Ожидание генерации устаревшей версии: key={} inFlight={} current={}", key, slot.version(), version);
            awaitQuietly(key, slot);
        }
    }

    /**
     * Удалить запись для ключа.
     */
    public void invalidate(GenerationKey key) {
        if (slots.remove(key) != null) {
            log.info("Кэш инструкций очищен: key={}", key);
        }
    }

    /**
     * Удалить все записи пациента.
     */
    public void invalidatePatient(String patientId) {
        boolean removed = slots.keySet().removeIf(k -> k.patientId().equals(patientId));
        if (removed) {
            log.info("Кэш инструкций пациента очищен: patientId={}", patientId);
        }
    }

    /**
     * Количество слотов (готовых и в работе).
     */
    public int size() {
        return slots.size();
    }

    /**
     * Количество вызывающих, ожидающих генерацию по ключу.
     */
    public int waiters(GenerationKey key) {
        Slot s = slots.get(key);
        return s == null ? 0 : s.waiters().get();
    }

    /**
     * Есть ли готовый результат для ключа и версии.
     */
    public boolean isCached(GenerationKey key, String version) {
        Slot s = slots.get(key);
        return s != null && s.version().equals(version)
                && s.future().isDone() && !s.future().isCompletedExceptionally();
    }

    private InstructionModels.PersonalizedInstructions runAsOwner(GenerationKey key,
                                                                  Slot slot,
                                                                  Supplier<InstructionModels.PersonalizedInstructions> generator) {
        InstructionModels.PersonalizedInstructions result;
        try {
            result = generator.get();
        } catch (RuntimeException e) {
            // Слот убирается до завершения future, чтобы повторный вызов начал генерацию заново.
            slots.remove(key, slot);
            slot.future().completeExceptionally(e);
            throw e;
        } catch (Error e) {
            slots.remove(key, slot);
            slot.future().completeExceptionally(e);
            throw e;
        }
        slot.future().complete(result);
        return result;
    }

    private InstructionModels.PersonalizedInstructions await(GenerationKey key, Slot slot) {
        slot.waiters().incrementAndGet();
        try {
            return slot.future().get(waitTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw DischargeAssistException.generationFailed("Генерация инструкций завершилась ошибкой");
        } catch (TimeoutException e) {
            log.warn("Истекло ожидание генерации инструкций: key={} waitMs={}", key, waitTimeoutMs);
            throw DischargeAssistException.serviceUnavailable("GENERATION_WAIT_TIMEOUT",
                    "Истекло ожидание генерации инструкций", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DischargeAssistException.serviceUnavailable("GENERATION_WAIT_INTERRUPTED",
                    "Ожидание генерации инструкций прервано", e);
        } finally {
            slot.waiters().decrementAndGet();
        }
    }

    private void awaitQuietly(GenerationKey key, Slot slot) {
        try {
            await(key, slot);
        } catch (DischargeAssistException e) {
            if (e.kind() == DischargeAssistException.ErrorKind.SERVICE_UNAVAILABLE
                    && e.errorCode().startsWith("GENERATION_WAIT")) {
                throw e;
            }
            // Исход генерации старой версии не важен: слот будет пересмотрен для текущей версии.
            log.debug("Генерация устаревшей версии завершилась ошибкой: key={} kind={}", key, e.kind());
        } catch (RuntimeException e) {
            log.debug("Генерация устаревшей версии завершилась ошибкой: key={} error={}", key, e.getClass().getSimpleName());
        }
    }

    private record Slot(String version,
                        CompletableFuture<InstructionModels.PersonalizedInstructions> future,
                        AtomicInteger waiters) {
    }
}
