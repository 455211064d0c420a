package org.example.flower_shop.navigation;

/**
 * Результат обработки события: какой экран показать и что на нём.
 */
public record RenderResult(String screenId, ScreenView view) {

    public boolean isHome() {
        return ScreenId.isHome(screenId);
    }
}
