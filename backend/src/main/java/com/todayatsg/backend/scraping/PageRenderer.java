package com.todayatsg.backend.scraping;

import com.todayatsg.backend.exception.FetchException;
import com.todayatsg.backend.model.dto.FetchedDocument;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Loads a page in a real browser and returns the DOM after scripts ran.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PageRenderer {

    private final ObjectProvider<WebDriver> webDriverProvider;

    public FetchedDocument render(String url) {
        WebDriver driver = null;
        try {
            driver = webDriverProvider.getObject();
            log.debug("Rendering {} with WebDriver", url);
            driver.get(url);
            return new FetchedDocument(url, 200, driver.getPageSource(), "text/html", LocalDateTime.now());
        } catch (TimeoutException e) {
            throw FetchException.timeout(url, e);
        } catch (WebDriverException e) {
            throw FetchException.io(url, e);
        } finally {
            if (driver != null) {
                try {
                    driver.quit();
                } catch (WebDriverException e) {
                    log.warn("Failed to quit WebDriver after rendering {}: {}", url, e.getMessage());
                }
            }
        }
    }
}
