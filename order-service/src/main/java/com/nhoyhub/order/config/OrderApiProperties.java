package com.nhoyhub.order.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "nhoyhub")
public class OrderApiProperties {

    private Admin admin = new Admin();
    private Storage storage = new Storage();
    private Orders orders = new Orders();
    private Cors cors = new Cors();
    private Config config = new Config();

    @Getter
    @Setter
    public static class Admin {
        private String username = "admin";
        private String password = "password123";
        // static bearer token, never expires
        private String token = "fake-jwt-token-for-admin";
    }

    @Getter
    @Setter
    public static class Storage {
        private String uploadDir = "images";
        private String placeholderName = "default.jpg";
        private String placeholderContent = "A placeholder image should be here.";
    }

    @Getter
    @Setter
    public static class Orders {
        private int defaultPageSize = 12;
        private int maxPageSize = 100;
        private int seedCount = 25;
    }

    @Getter
    @Setter
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of(
                "http://127.0.0.1:5500",
                "http://localhost:5500",
                "http://127.0.0.1:8000",
                "http://localhost:8000",
                "http://127.0.0.1",
                "http://localhost"
        ));
    }

    @Getter
    @Setter
    public static class Config {
        private String publicImageUrl = "https://via.placeholder.com/600x400/9C27B0/ffffff?text=Public+Image";
    }
}
