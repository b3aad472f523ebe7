package com.cityexplorer.backend;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(classes = CityExplorerApplication.class)
@Testcontainers(disabledWithoutDocker = true)
class CityExplorerFullIntegrationTest {

    private static final Logger logger = LoggerFactory.getLogger(CityExplorerFullIntegrationTest.class);

    private static final int WIREMOCK_PORT = 8089;
    private static final String WIREMOCK_URL = "http://localhost:" + WIREMOCK_PORT + "/";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("city_explorer_test")
            .withUsername("test")
            .withPassword("test");

    private static WireMockServer wireMockServer;

    @Autowired
    private WebApplicationContext webApplicationContext;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private MockMvc mockMvc;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);

        for (String provider : List.of("geocode", "weather", "events", "movies", "yelp")) {
            registry.add("cityexplorer.providers." + provider + ".base-url", () -> WIREMOCK_URL);
            registry.add("cityexplorer.providers." + provider + ".api-key", () -> "test-" + provider + "-key");
        }
    }

    @BeforeAll
    static void startWireMock() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().port(WIREMOCK_PORT));
        wireMockServer.start();
        configureFor("localhost", WIREMOCK_PORT);
    }

    @AfterAll
    static void stopWireMock() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
    }

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.webAppContextSetup(webApplicationContext).build();
        wireMockServer.resetAll();
        for (String table : List.of("locations", "weathers", "events", "movies", "yelps")) {
            jdbcTemplate.execute("DELETE FROM " + table);
        }
        logger.info("Database and upstream stubs reset");
    }

    @Test
    void shouldGeocodeOnceAndServeLocationFromCache() throws Exception {
        // Given
        stubFor(WireMock.get(urlPathEqualTo("/maps/api/geocode/json"))
                .withQueryParam("address", equalTo("Seattle"))
                .withQueryParam("key", equalTo("test-geocode-key"))
                .willReturn(okJson("""
                        {"results": [{
                            "formatted_address": "Seattle, WA, USA",
                            "geometry": {"location": {"lat": 47.6062, "lng": -122.3321}},
                            "place_id": "ignored"
                        }], "status": "OK"}
                        """)));

        // When & Then
        performAsync(get("/location").param("data", "Seattle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.search_query", is("Seattle")))
                .andExpect(jsonPath("$.formatted_query", is("Seattle, WA, USA")))
                .andExpect(jsonPath("$.latitude", is(47.6062)));

        performAsync(get("/location").param("data", "Seattle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.formatted_query", is("Seattle, WA, USA")));

        verify(1, getRequestedFor(urlPathEqualTo("/maps/api/geocode/json")));
        Integer rows = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM locations WHERE search_query = 'Seattle'", Integer.class);
        assertThat(rows).isEqualTo(1);
    }

    @Test
    void shouldReturnNoContentWhenGeocoderFindsNothing() throws Exception {
        // Given
        stubFor(WireMock.get(urlPathEqualTo("/maps/api/geocode/json"))
                .willReturn(okJson("{\"results\": [], \"status\": \"ZERO_RESULTS\"}")));

        // When & Then
        performAsync(get("/location").param("data", "Nowhereville"))
                .andExpect(status().isNoContent());

        Integer rows = jdbcTemplate.queryForObject("SELECT count(*) FROM locations", Integer.class);
        assertThat(rows).isEqualTo(0);
    }

    @Test
    void shouldStoreForecastRowsAndServeThemWhileFresh() throws Exception {
        // Given
        stubFor(WireMock.get(urlPathMatching("/forecast/test-weather-key/.*"))
                .willReturn(okJson("""
                        {"daily": {"data": [
                            {"summary": "Light rain", "time": 1704067200},
                            {"summary": "Partly cloudy", "time": 1704153600}
                        ]}}
                        """)));

        // When & Then
        performAsync(locationRequest("/weather"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].location_id", is(42)))
                .andExpect(jsonPath("$[0].forecast", is("Light rain")))
                .andExpect(jsonPath("$[0].time", is("Mon Jan 01 2024")))
                .andExpect(jsonPath("$[1].time", is("Tue Jan 02 2024")));

        performAsync(locationRequest("/weather"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));

        verify(1, getRequestedFor(urlPathMatching("/forecast/.*")));
    }

    @Test
    void shouldReturnEmptyListWhenProviderHasNoEvents() throws Exception {
        // Given
        stubFor(WireMock.get(urlPathEqualTo("/v3/events/search/"))
                .willReturn(okJson("{\"events\": []}")));

        // When & Then
        performAsync(locationRequest("/events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));

        Integer rows = jdbcTemplate.queryForObject("SELECT count(*) FROM events", Integer.class);
        assertThat(rows).isEqualTo(0);
    }

    @Test
    void shouldReturnBadGatewayWhenProviderFails() throws Exception {
        // Given
        stubFor(WireMock.get(urlPathEqualTo("/v3/businesses/search"))
                .withHeader("Authorization", equalTo("Bearer test-yelp-key"))
                .willReturn(aResponse().withStatus(500)));

        // When & Then
        performAsync(locationRequest("/yelp"))
                .andExpect(status().isBadGateway());

        mockMvc.perform(get("/cache/stats").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.upstream_fetches", greaterThanOrEqualTo(1)));
    }

    private ResultActions performAsync(MockHttpServletRequestBuilder builder) throws Exception {
        MvcResult started = mockMvc.perform(builder)
                .andExpect(request().asyncStarted())
                .andReturn();
        return mockMvc.perform(asyncDispatch(started));
    }

    private MockHttpServletRequestBuilder locationRequest(String path) {
        return get(path)
                .param("data[id]", "42")
                .param("data[latitude]", "47.6062")
                .param("data[longitude]", "-122.3321");
    }
}
