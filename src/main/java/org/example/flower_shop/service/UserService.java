package org.example.flower_shop.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.flower_shop.config.AdminConfig;
import org.example.flower_shop.model.User;
import org.example.flower_shop.repository.UserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class UserService {

    private final UserRepository userRepository;
    private final AdminConfig adminConfig;

    /**
     * Сохранить покупателя при /start. Если уже есть — обновляем имя и username
     * (в Telegram их можно поменять).
     *
     * @return true если пользователь новый
     */
    public boolean registerOrUpdate(Long telegramId, String username, String firstName, String lastName) {
        Optional<User> existing = userRepository.findByTelegramId(telegramId);
        if (existing.isPresent()) {
            User user = existing.get();
            user.setUsername(username);
            user.setFirstName(firstName);
            user.setLastName(lastName);
            userRepository.save(user);
            log.debug("Пользователь уже зарегистрирован: telegramId={}", telegramId);
            return false;
        }

        User user = User.builder()
                .telegramId(telegramId)
                .username(username)
                .firstName(firstName)
                .lastName(lastName)
                .build();
        User saved = userRepository.save(user);
        log.info("Новый пользователь: id={}, telegramId={}", saved.getId(), telegramId);
        return true;
    }

    @Transactional(readOnly = true)
    public List<User> latestUsers() {
        return userRepository.findTop20ByOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public long countUsers() {
        return userRepository.count();
    }

    public boolean isAdmin(Long telegramId) {
        return adminConfig.isAdmin(telegramId);
    }
}
