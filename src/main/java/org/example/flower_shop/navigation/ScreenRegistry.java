package org.example.flower_shop.navigation;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.example.flower_shop.exception.UnknownScreenException;
import org.example.flower_shop.screen.ScreenModule;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Реестр экранов: id экрана → рендерер.
 * <p>
 * Известные экраны (ScreenId) лежат в EnumMap, динамические
 * ("ai_preset:birthday") — в отдельной открытой мапе.
 * Повторная регистрация того же id заменяет рендерер (последний побеждает).
 * <p>
 * Модули экранов (ScreenModule) регистрируются при старте, порядок не важен.
 * После старта реестр только читают.
 */
@Slf4j
@Component
public class ScreenRegistry {

    private final Map<ScreenId, ScreenRenderer> knownScreens = new EnumMap<>(ScreenId.class);
    private final Map<String, ScreenRenderer> dynamicScreens = new ConcurrentHashMap<>();
    private final List<ScreenModule> modules;

    public ScreenRegistry(List<ScreenModule> modules) {
        this.modules = modules;
    }

    @PostConstruct
    public void init() {
        for (ScreenModule module : modules) {
            module.registerScreens(this);
        }
        log.info("Зарегистрировано экранов: {} известных, {} динамических",
                knownScreens.size(), dynamicScreens.size());
    }

    public synchronized void register(ScreenId id, ScreenRenderer renderer) {
        ScreenRenderer previous = knownScreens.put(id, renderer);
        if (previous != null) {
            log.debug("Рендерер экрана {} заменён", id.getId());
        }
    }

    /**
     * Регистрация по строковому id. Если id совпадает с известным экраном — кладём в EnumMap.
     */
    public synchronized void register(String id, ScreenRenderer renderer) {
        Optional<ScreenId> known = ScreenId.fromId(id);
        if (known.isPresent()) {
            register(known.get(), renderer);
            return;
        }
        if (dynamicScreens.put(id, renderer) != null) {
            log.debug("Рендерер экрана {} заменён", id);
        }
    }

    /**
     * Найти рендерер экрана.
     *
     * @throws UnknownScreenException если экран не зарегистрирован
     */
    public ScreenRenderer resolve(String id) {
        ScreenRenderer renderer = ScreenId.fromId(id)
                .map(knownScreens::get)
                .orElseGet(() -> id != null ? dynamicScreens.get(id) : null);
        if (renderer == null) {
            throw new UnknownScreenException(id);
        }
        return renderer;
    }

    public boolean isRegistered(String id) {
        return ScreenId.fromId(id).map(knownScreens::containsKey).orElse(false)
                || (id != null && dynamicScreens.containsKey(id));
    }
}
