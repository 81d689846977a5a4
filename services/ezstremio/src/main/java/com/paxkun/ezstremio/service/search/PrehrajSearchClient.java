package com.paxkun.ezstremio.service.search;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * PrehrajSearchClient searches prehraj.to through one headless Chrome session and parses
 * the result list with Jsoup. The site answers plain HTTP clients with a bot wall, so a
 * real browser is needed here.
 * <p>
 * The browser is a single shared resource: {@link #search(String)} is serialized and the
 * search stage runs with a concurrency of 1.
 */
@Slf4j
@Component
public class PrehrajSearchClient implements SearchClient, DisposableBean {

    private static final String RESULT_SELECTOR = "a.video--link";

    @Value("${prehraj.baseUrl:https://prehraj.to}")
    private String baseUrl = "https://prehraj.to";

    @Value("${prehraj.userAgent:Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/123.0.0.0 Safari/537.36}")
    private String userAgent;

    @Value("${prehraj.browser.binary:}")
    private String browserBinary;

    @Value("${prehraj.browser.pageLoadSeconds:20}")
    private long pageLoadSeconds = 20;

    @Value("${prehraj.browser.settleMillis:2000}")
    private long settleMillis = 2000;

    private WebDriver driver;

    @Override
    public synchronized List<Candidate> search(String query) {
        String searchUrl = baseUrl + "/hledej/" + URLEncoder.encode(query, StandardCharsets.UTF_8).replace("+", "%20");
        String html;
        try {
            WebDriver browser = browser();
            browser.get(searchUrl);
            new WebDriverWait(browser, Duration.ofSeconds(pageLoadSeconds)).until(
                    d -> "complete".equals(((JavascriptExecutor) d).executeScript("return document.readyState")));
            // lazy-loaded tiles
            Thread.sleep(settleMillis);
            html = browser.getPageSource();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceFetchException("Interrupted while loading " + searchUrl, e);
        } catch (WebDriverException e) {
            quitBrowser();
            throw new SourceFetchException("Browser failed to load " + searchUrl + ": " + e.getMessage(), e);
        }

        List<Candidate> results = parseResults(html, baseUrl);
        if (results.isEmpty()) {
            Document doc = Jsoup.parse(html);
            log.debug("No results for '{}'. Page title: '{}', body length: {}", query, doc.title(), html.length());
        } else {
            log.info("🔍 Found {} prehraj.to results for '{}'", results.size(), query);
        }
        return results;
    }

    /**
     * Extracts hits from a search result page. Uses the result-tile selector first and,
     * when the layout changed and nothing matched, any link whose text carries both a size
     * and a duration.
     */
    static List<Candidate> parseResults(String html, String baseUrl) {
        Document doc = Jsoup.parse(html, baseUrl);
        List<Candidate> results = new ArrayList<>();

        for (Element link : doc.select(RESULT_SELECTOR)) {
            if (link.hasAttr("href")) {
                parseLink(link, results);
            }
        }

        if (results.isEmpty()) {
            for (Element link : doc.select("a[href]")) {
                String href = link.attr("href");
                if (href.startsWith("/hledej") || href.startsWith("/profil") || href.startsWith("/cenik")) {
                    continue;
                }
                String text = link.text();
                if ((text.contains("MB") || text.contains("GB")) && text.contains(":")) {
                    parseLink(link, results);
                }
            }
        }
        return results;
    }

    private static void parseLink(Element link, List<Candidate> results) {
        String duration = "";
        String size = "";
        String title = "";

        String fullText = link.wholeText();
        for (String rawLine : fullText.split("\n")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.contains(":") && line.length() < 10) {
                duration = line;
            } else if (line.contains("MB") || line.contains("GB") || line.contains("kB")) {
                size = line;
            } else {
                title = line;
            }
        }

        if (title.isEmpty() && (!size.isEmpty() || !duration.isEmpty())) {
            title = link.hasAttr("title") ? link.attr("title") : fullText.trim();
        }
        if (title.isEmpty()) {
            return;
        }

        String address = link.absUrl("href");
        if (address.isEmpty()) {
            return;
        }
        results.add(new Candidate(title, duration, size, address));
    }

    private WebDriver browser() {
        if (driver == null) {
            ChromeOptions options = new ChromeOptions();
            options.addArguments("--headless=new", "--disable-gpu", "--no-sandbox", "--disable-dev-shm-usage",
                    "--user-agent=" + userAgent);
            if (browserBinary != null && !browserBinary.isBlank()) {
                options.setBinary(browserBinary);
            }
            driver = new ChromeDriver(options);
            driver.manage().timeouts().pageLoadTimeout(Duration.ofSeconds(pageLoadSeconds));
            log.info("🌐 Started headless browser session for prehraj.to");
        }
        return driver;
    }

    private void quitBrowser() {
        if (driver != null) {
            try {
                driver.quit();
            } catch (WebDriverException e) {
                log.warn("⚠️ Failed to close browser session: {}", e.getMessage());
            }
            driver = null;
        }
    }

    @Override
    public synchronized void destroy() {
        quitBrowser();
    }
}
