package com.nhoyhub.order.controller;

import com.nhoyhub.order.dto.ConfigUpdateRequest;
import com.nhoyhub.order.security.AdminOnly;
import com.nhoyhub.order.service.ConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/config")
@RequiredArgsConstructor
public class ConfigController {

    private final ConfigService configService;

    @AdminOnly
    @GetMapping
    public ResponseEntity<Map<String, String>> getConfig() {
        log.info("Received get config request");
        return ResponseEntity.ok(configService.getAll());
    }

    @AdminOnly
    @PutMapping("/public")
    public ResponseEntity<Map<String, String>> updatePublicImageUrl(@RequestBody ConfigUpdateRequest request) {
        log.info("Received public image URL update request");
        return ResponseEntity.ok(configService.updatePublicImageUrl(request.getPublicImageUrl()));
    }

    @AdminOnly
    @PutMapping("/esign/{index}")
    public ResponseEntity<Map<String, String>> updateEsignUrl(@PathVariable int index,
                                                              @RequestBody ConfigUpdateRequest request) {
        log.info("Received esign image update request: {}", index);
        return ResponseEntity.ok(configService.updateEsignUrl(index, request.getUrl()));
    }
}
