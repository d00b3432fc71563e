package com.todayatsg.backend.scraping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.todayatsg.backend.exception.FetchException;
import com.todayatsg.backend.model.dto.FetchedDocument;
import com.todayatsg.backend.model.enums.FetchFailureReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.springframework.beans.factory.ObjectProvider;

@ExtendWith(MockitoExtension.class)
class PageRendererTest {

    private static final String URL = "https://www.marinabaysands.com/entertainment/shows.html";

    @Mock
    private ObjectProvider<WebDriver> webDriverProvider;

    @Mock
    private WebDriver driver;

    private PageRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new PageRenderer(webDriverProvider);
        when(webDriverProvider.getObject()).thenReturn(driver);
    }

    @Test
    void returnsRenderedDomAndQuits() {
        when(driver.getPageSource()).thenReturn("<html><body><div class=\"show\">Lion King</div></body></html>");

        FetchedDocument document = renderer.render(URL);

        assertThat(document.getUrl()).isEqualTo(URL);
        assertThat(document.getStatusCode()).isEqualTo(200);
        assertThat(document.getBody()).contains("Lion King");
        verify(driver).get(URL);
        verify(driver).quit();
    }

    @Test
    void pageLoadTimeoutIsAFetchTimeout() {
        doThrow(new TimeoutException("page load took too long")).when(driver).get(URL);

        assertThatThrownBy(() -> renderer.render(URL))
                .isInstanceOf(FetchException.class)
                .satisfies(e -> assertThat(((FetchException) e).getReason()).isEqualTo(FetchFailureReason.TIMEOUT));
        verify(driver).quit();
    }

    @Test
    void browserErrorIsAnIoFailure() {
        doThrow(new WebDriverException("chrome not reachable")).when(driver).get(URL);

        assertThatThrownBy(() -> renderer.render(URL))
                .isInstanceOf(FetchException.class)
                .satisfies(e -> assertThat(((FetchException) e).getReason()).isEqualTo(FetchFailureReason.IO));
        verify(driver).quit();
    }

    @Test
    void failingQuitDoesNotHideTheDocument() {
        when(driver.getPageSource()).thenReturn("<html>ok</html>");
        doThrow(new WebDriverException("session gone")).when(driver).quit();

        FetchedDocument document = renderer.render(URL);

        assertThat(document.getBody()).isEqualTo("<html>ok</html>");
    }
}
