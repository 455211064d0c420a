package org.example.flower_shop.navigation;

import java.util.Arrays;
import java.util.Optional;

/**
 * Известные экраны бота.
 * <p>
 * Закрытый список: рендереры для них лежат в EnumMap внутри ScreenRegistry.
 * Динамические экраны (результаты AI-подборки "ai_preset:birthday" и т.п.)
 * сюда не входят — они регистрируются по строковому id.
 */
public enum ScreenId {
    START("start"),
    AI_MENU("ai_menu"),
    CATALOG("catalog"),
    CART("cart"),
    HISTORY("history"),
    RECOMMEND_PRESETS("recommend_presets"),
    ADMIN_MAIN("admin_main"),
    ADMIN_LIST_FLOWERS("admin_list_flowers"),
    ADMIN_ORDERS("admin_orders"),
    ADMIN_USERS("admin_users"),
    ADMIN_DELETE_FLOWER("admin_delete_flower");

    /** Главное меню — туда ведёт "Назад" при пустом стеке */
    public static final ScreenId HOME = START;

    private final String id;

    ScreenId(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /** Экран раздела администратора */
    public boolean isAdminScreen() {
        return id.startsWith("admin_");
    }

    public static Optional<ScreenId> fromId(String id) {
        return Arrays.stream(values())
                .filter(s -> s.id.equals(id))
                .findFirst();
    }

    public static boolean isHome(String id) {
        return HOME.id.equals(id);
    }
}
