package com.todayatsg.backend.config;

import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.context.annotation.Scope;

/**
 * Browser used to render sources flagged {@code javascript: true}. A fresh driver is
 * created per page and quit afterwards; nothing starts a browser at boot.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class WebDriverConfig {

    private final ScrapingConfig scrapingConfig;

    @Value("${scraper.webdriver.type:chrome}")
    private String webDriverType;

    @Value("${scraper.webdriver.headless:true}")
    private boolean headless;

    @Value("${scraper.webdriver.timeout:30}")
    private int timeoutSeconds;

    @Value("${scraper.webdriver.window.width:1920}")
    private int windowWidth;

    @Value("${scraper.webdriver.window.height:1080}")
    private int windowHeight;

    @Bean
    @Lazy
    @Scope("prototype")
    public WebDriver webDriver() {
        log.info("Creating WebDriver instance: type={}, headless={}", webDriverType, headless);

        WebDriver driver = switch (webDriverType.toLowerCase()) {
            case "firefox" -> createFirefoxDriver();
            default -> createChromeDriver();
        };

        driver.manage().timeouts().pageLoadTimeout(Duration.ofSeconds(timeoutSeconds));
        driver.manage().timeouts().implicitlyWait(Duration.ofSeconds(5));
        driver.manage().window().setSize(new Dimension(windowWidth, windowHeight));

        return driver;
    }

    private WebDriver createChromeDriver() {
        ChromeOptions options = new ChromeOptions();

        if (headless) {
            options.addArguments("--headless=new");
        }

        options.addArguments("--no-sandbox");
        options.addArguments("--disable-dev-shm-usage");
        options.addArguments("--disable-gpu");
        options.addArguments("--disable-extensions");
        options.addArguments("--blink-settings=imagesEnabled=false");
        options.addArguments("--user-agent=" + scrapingConfig.getUserAgent());

        return new ChromeDriver(options);
    }

    private WebDriver createFirefoxDriver() {
        FirefoxOptions options = new FirefoxOptions();

        if (headless) {
            options.addArguments("--headless");
        }

        // Listing pages need scripts; images are never used
        options.addPreference("permissions.default.image", 2);
        options.addPreference("general.useragent.override", scrapingConfig.getUserAgent());

        return new FirefoxDriver(options);
    }
}
