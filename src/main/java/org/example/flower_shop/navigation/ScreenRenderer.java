package org.example.flower_shop.navigation;

import org.example.flower_shop.model.SessionSnapshot;

/**
 * Рендерер экрана: (снимок сессии, контекст) → что показать.
 * Стек навигации рендерер не трогает.
 */
@FunctionalInterface
public interface ScreenRenderer {

    ScreenView render(SessionSnapshot session, RenderContext context);
}
