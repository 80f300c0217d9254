package com.nhoyhub.order.service;

import com.nhoyhub.order.exception.ValidationException;
import com.nhoyhub.order.repository.ConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConfigService {

    private final ConfigRepository configRepository;

    public Map<String, String> getAll() {
        return configRepository.findAll();
    }

    public Map<String, String> updatePublicImageUrl(String url) {
        if (url == null) {
            throw new ValidationException("Missing public_image_url field");
        }

        configRepository.put(ConfigRepository.PUBLIC_IMAGE_URL, url);
        log.info("Public image URL updated: {}", url);

        Map<String, String> ack = new LinkedHashMap<>();
        ack.put("message", "Public image URL updated");
        ack.put(ConfigRepository.PUBLIC_IMAGE_URL, url);
        return ack;
    }

    public Map<String, String> updateEsignUrl(int index, String url) {
        if (index < 1 || index > ConfigRepository.ESIGN_SLOTS) {
            throw new ValidationException("Esign index must be between 1 and " + ConfigRepository.ESIGN_SLOTS);
        }
        if (url == null) {
            throw new ValidationException("Missing url field");
        }

        String key = ConfigRepository.esignKey(index);
        configRepository.put(key, url);
        log.info("Esign image {} updated: {}", index, url);

        Map<String, String> ack = new LinkedHashMap<>();
        ack.put("message", "Esign image " + index + " updated");
        ack.put(key, url);
        return ack;
    }
}
