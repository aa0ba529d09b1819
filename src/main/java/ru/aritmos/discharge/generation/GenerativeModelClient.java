package ru.aritmos.discharge.generation;

/**
 * Клиент генеративной модели.
 * <p>
 * Единственная точка, через которую ядро обращается к внешней модели. Реализация обязана:
 * <ul>
 *   <li>принимать только отредактированные (без ПДн) промпты;</li>
 *   <li>при недоступности, таймауте или отсутствии конфигурации бросать
 *   {@code DischargeAssistException} с видом SERVICE_UNAVAILABLE;</li>
 *   <li>не подменять отказ каким-либо «запасным» текстом.</li>
 * </ul>
 */
public interface GenerativeModelClient {

    /**
     * Выполнить генерацию.
     *
     * @param request запрос (системный и пользовательский промпты, параметры генерации)
     * @return сырой текст ответа модели
     */
    String generate(GenerationRequest request);

    /**
     * @return true, если клиент сконфигурирован и может обращаться к модели
     */
    boolean isConfigured();
}
