package org.example.flower_shop.model;

/**
 * Готовые поводы для AI-подборки букета (кнопки в меню "🤖 AI подбор").
 */
public enum AiPreset {
    BIRTHDAY("birthday", "🎂 День рождения", "день рождения", 2000),
    ROMANCE("romance", "❤️ Романтика", "романтическое свидание", 3000),
    WEDDING("wedding", "💍 Свадьба", "свадьба", 5000),
    MOTHER("mother", "👩 Маме", "подарок маме", 2500),
    SYMPATHY("sympathy", "🕊 Соболезнование", "соболезнование", 1500);

    /** Префикс id динамического экрана с результатом: "ai_preset:birthday" */
    public static final String SCREEN_PREFIX = "ai_preset:";

    private final String id;
    private final String displayName;
    private final String occasion;
    private final int budget;

    AiPreset(String id, String displayName, String occasion, int budget) {
        this.id = id;
        this.displayName = displayName;
        this.occasion = occasion;
        this.budget = budget;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getOccasion() {
        return occasion;
    }

    public int getBudget() {
        return budget;
    }

    public String getScreenId() {
        return SCREEN_PREFIX + id;
    }
}
