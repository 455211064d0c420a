package org.example.flower_shop.screen;

import lombok.RequiredArgsConstructor;
import org.example.flower_shop.model.AiPreset;
import org.example.flower_shop.model.SessionSnapshot;
import org.example.flower_shop.navigation.CallbackData;
import org.example.flower_shop.navigation.RenderContext;
import org.example.flower_shop.navigation.ScreenAction;
import org.example.flower_shop.navigation.ScreenId;
import org.example.flower_shop.navigation.ScreenRegistry;
import org.example.flower_shop.navigation.ScreenView;
import org.example.flower_shop.service.RecommendationService;
import org.springframework.stereotype.Component;

/**
 * AI-подбор букета: меню, список поводов и результат по каждому поводу.
 * <p>
 * Результаты — динамические экраны "ai_preset:&lt;повод&gt;", регистрируются по одному на повод.
 */
@Component
@RequiredArgsConstructor
public class AiScreens implements ScreenModule {

    private final RecommendationService recommendationService;

    @Override
    public void registerScreens(ScreenRegistry registry) {
        registry.register(ScreenId.AI_MENU, this::renderAiMenu);
        registry.register(ScreenId.RECOMMEND_PRESETS, this::renderPresets);
        for (AiPreset preset : AiPreset.values()) {
            registry.register(preset.getScreenId(), (session, context) -> renderPresetResult(preset));
        }
    }

    ScreenView renderAiMenu(SessionSnapshot session, RenderContext context) {
        return ScreenView.of("🤖 AI подбор букета\n\n" +
                        "Подскажу, что подарить — выберите повод,\n" +
                        "или соберите букет сами в конструкторе.",
                new ScreenView.Rows()
                        .add(ScreenAction.enter("🎯 Выбрать повод", ScreenId.RECOMMEND_PRESETS))
                        .add(ScreenAction.of("🎨 Собрать букет", CallbackData.BUILD_START))
                        .add(ScreenAction.enter("🌸 Весь каталог", ScreenId.CATALOG))
                        .build());
    }

    ScreenView renderPresets(SessionSnapshot session, RenderContext context) {
        ScreenView.Rows rows = new ScreenView.Rows();
        for (AiPreset preset : AiPreset.values()) {
            rows.add(ScreenAction.enter(preset.getDisplayName() + " (до " + preset.getBudget() + "₽)",
                    preset.getScreenId()));
        }
        return ScreenView.of("🎯 Какой повод?", rows.build());
    }

    ScreenView renderPresetResult(AiPreset preset) {
        String recommendation = recommendationService.recommend(preset);
        return ScreenView.of(recommendation, new ScreenView.Rows()
                .add(ScreenAction.enter("🌸 В каталог", ScreenId.CATALOG))
                .add(ScreenAction.of("🎨 Собрать свой", CallbackData.BUILD_START))
                .build());
    }
}
