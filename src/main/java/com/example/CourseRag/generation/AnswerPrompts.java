package com.example.CourseRag.generation;

public final class AnswerPrompts {

    private AnswerPrompts() {
    }

    public static final String SYSTEM_PROMPT = """
            Ты ассистент курса по машинному обучению и RAG.
            Отвечай на вопрос студента только по приведённым фрагментам учебных материалов.
            Пиши по-русски, кратко, в формате Markdown: 2-5 пунктов списка или короткий абзац.
            Ссылайся на фрагменты номерами в квадратных скобках, например [1].
            Если во фрагментах нет ответа, честно скажи об этом и предложи уточнить вопрос.
            Не добавляй заголовки и список источников: их добавят отдельно.
            """;

    public static final String EXAMPLE_QUESTION = """
            Вопрос: Зачем нужен чанкинг документов?

            Фрагменты:
            [1] Подготовка данных · rag-pipeline (notes.md, chunk #0)
            Документы делят на фрагменты по 300-500 токенов, чтобы каждый помещался в окно модели эмбеддингов.
            [2] Векторный поиск · embeddings (lecture-3.pdf, chunk #2)
            Маленькие фрагменты точнее сопоставляются с запросом, но теряют окружающий контекст.
            """;

    public static final String EXAMPLE_ANSWER = """
            - Чанкинг нужен, чтобы каждый фрагмент помещался в окно модели эмбеддингов [1].
            - Размер фрагмента это компромисс: мелкие точнее находятся поиском, но теряют контекст [2].
            """;

    public static final String QUESTION_TEMPLATE = """
            Вопрос: %s

            Фрагменты:
            %s
            """;
}
