package org.example.flower_shop.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.flower_shop.model.Flower;
import org.example.flower_shop.repository.FlowerRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Каталог букетов.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class FlowerService {

    private final FlowerRepository flowerRepository;

    public List<Flower> getAvailableFlowers() {
        return flowerRepository.findByAvailableTrueOrderByIdAsc();
    }

    public List<Flower> getAllFlowers() {
        return flowerRepository.findAllByOrderByIdAsc();
    }

    public Optional<Flower> findAvailable(Long flowerId) {
        return flowerRepository.findById(flowerId)
                .filter(f -> Boolean.TRUE.equals(f.getAvailable()));
    }

    /**
     * Добавить букет в каталог (админка). Сразу в наличии.
     */
    @Transactional
    public Flower addFlower(String name, String description, BigDecimal price, String category) {
        Flower flower = Flower.builder()
                .name(name)
                .description(description)
                .price(price)
                .category(category)
                .build();
        Flower saved = flowerRepository.save(flower);
        log.info("Букет добавлен в каталог: id={}, name={}, price={}", saved.getId(), saved.getName(), saved.getPrice());
        return saved;
    }

    /**
     * Удалить букет из каталога. Заказы хранят состав текстом, поэтому
     * удаление не ломает историю.
     *
     * @return false если такого букета нет
     */
    @Transactional
    public boolean deleteFlower(Long flowerId) {
        Optional<Flower> flower = flowerRepository.findById(flowerId);
        if (flower.isEmpty()) {
            log.warn("Удаление несуществующего букета: id={}", flowerId);
            return false;
        }
        flowerRepository.delete(flower.get());
        log.info("Букет удалён из каталога: id={}, name={}", flowerId, flower.get().getName());
        return true;
    }

    /**
     * Самый "ходовой" букет для главного меню — пока просто первый в наличии.
     */
    public Optional<Flower> getPopularFlower() {
        return getAvailableFlowers().stream().findFirst();
    }
}
