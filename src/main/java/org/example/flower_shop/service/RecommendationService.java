package org.example.flower_shop.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.example.flower_shop.model.AiPreset;
import org.example.flower_shop.model.Flower;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * AI-подборка букета через Perplexity (chat completions).
 * <p>
 * Если ключ не задан или API не ответило — подбираем сами по бюджету из каталога.
 * Наружу ошибки не выбрасываем: юзер всегда получает какой-то текст.
 */
@Slf4j
@Service
public class RecommendationService {

    private static final String PLACEHOLDER_KEY = "your_perplexity_key_here";

    private final FlowerService flowerService;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RestTemplate restTemplate;

    @Value("${perplexity.api-key:}")
    private String apiKey;

    @Value("${perplexity.url:https://api.perplexity.ai/chat/completions}")
    private String apiUrl;

    @Value("${perplexity.model:llama-3.1-sonar-small-128k-online}")
    private String model;

    public RecommendationService(FlowerService flowerService) {
        this.flowerService = flowerService;
        this.restTemplate = new RestTemplate();
        this.restTemplate.getMessageConverters()
                .add(0, new StringHttpMessageConverter(StandardCharsets.UTF_8));
    }

    public String recommend(AiPreset preset) {
        List<Flower> flowers = flowerService.getAvailableFlowers();

        if (apiKey == null || apiKey.isBlank() || PLACEHOLDER_KEY.equals(apiKey)) {
            log.debug("Ключ Perplexity не задан, подбор по каталогу: preset={}", preset.getId());
            return fallbackRecommendation(preset, flowers);
        }

        try {
            return "🌸 " + askPerplexity(preset, flowers);
        } catch (RestClientException | IllegalStateException e) {
            log.warn("Perplexity недоступен, подбор по каталогу: preset={}, error={}", preset.getId(), e.getMessage());
            return fallbackRecommendation(preset, flowers);
        }
    }

    private String askPerplexity(AiPreset preset, List<Flower> flowers) {
        String catalog = flowers.stream()
                .map(f -> "- " + f.getName() + ": " + f.getDescription() + ", цена: " + f.getPrice() + "₽")
                .collect(Collectors.joining("\n"));

        Map<String, Object> body = Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system",
                                "content", "Ты флорист-консультант. Доступные букеты:\n" + catalog),
                        Map.of("role", "user",
                                "content", "Порекомендуй букет. Повод: " + preset.getOccasion()
                                        + ", бюджет: " + preset.getBudget() + "₽")
                )
        );

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);

        ResponseEntity<String> response = restTemplate.postForEntity(apiUrl, new HttpEntity<>(body, headers), String.class);
        try {
            JsonNode root = objectMapper.readTree(response.getBody());
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            if (content.isMissingNode() || content.asText().isBlank()) {
                throw new IllegalStateException("Пустой ответ Perplexity");
            }
            return content.asText();
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new IllegalStateException("Не удалось разобрать ответ Perplexity", e);
        }
    }

    /**
     * Подбор без AI: самый дорогой букет, который влезает в бюджет, плюс пара альтернатив.
     */
    String fallbackRecommendation(AiPreset preset, List<Flower> flowers) {
        BigDecimal budget = BigDecimal.valueOf(preset.getBudget());
        List<Flower> fitting = flowers.stream()
                .filter(f -> f.getPrice().compareTo(budget) <= 0)
                .sorted(Comparator.comparing(Flower::getPrice).reversed())
                .toList();

        StringBuilder sb = new StringBuilder();
        sb.append("🌸 Подборка: ").append(preset.getDisplayName()).append("\n");
        sb.append("Бюджет: до ").append(preset.getBudget()).append("₽\n\n");

        if (fitting.isEmpty()) {
            sb.append("В этот бюджет готовых букетов нет 😔\n")
                    .append("Попробуйте собрать свой в конструкторе 🎨");
            return sb.toString();
        }

        Flower best = fitting.get(0);
        sb.append("💐 Рекомендуем: ").append(best.getName()).append("\n");
        if (best.getDescription() != null) {
            sb.append(best.getDescription()).append("\n");
        }
        sb.append("Цена: ").append(best.getPrice()).append("₽");

        if (fitting.size() > 1) {
            sb.append("\n\nИли рассмотрите:");
            fitting.stream().skip(1).limit(2)
                    .forEach(f -> sb.append("\n• ").append(f.getName()).append(" — ").append(f.getPrice()).append("₽"));
        }
        return sb.toString();
    }
}
