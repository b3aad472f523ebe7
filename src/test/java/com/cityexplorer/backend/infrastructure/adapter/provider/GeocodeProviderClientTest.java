package com.cityexplorer.backend.infrastructure.adapter.provider;

import com.cityexplorer.backend.domain.exception.NoUpstreamDataException;
import com.cityexplorer.backend.infrastructure.adapter.mapper.LocationMapper;
import com.cityexplorer.backend.infrastructure.adapter.provider.json.GeocodeJson;
import com.cityexplorer.backend.infrastructure.config.ProviderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import retrofit2.Call;
import retrofit2.Response;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GeocodeProviderClientTest {

    @Mock
    private GeocodeApi geocodeApi;

    @Mock
    private Call<GeocodeJson> mockCall;

    private GeocodeProviderClient geocodeClient;

    @BeforeEach
    void setUp() {
        ProviderProperties properties = new ProviderProperties();
        properties.getGeocode().setApiKey("geo-key");
        geocodeClient = new GeocodeProviderClient(geocodeApi, new LocationMapper(), properties);
    }

    @Test
    void shouldKeepOnlyBestMatch() throws Exception {
        // Given
        GeocodeJson body = new GeocodeJson(List.of(
                result("Seattle, WA, USA", 47.6062, -122.3321),
                result("Seattle Hill, WA, USA", 47.87, -122.16)
        ));
        when(geocodeApi.geocode("Seattle", "geo-key")).thenReturn(mockCall);
        when(mockCall.execute()).thenReturn(Response.success(body));

        // When
        List<Map<String, Object>> records = geocodeClient.fetchLocation("Seattle").get(5, TimeUnit.SECONDS);

        // Then
        assertThat(records).hasSize(1);
        assertThat(records.get(0))
                .containsEntry("formatted_query", "Seattle, WA, USA")
                .containsEntry("latitude", 47.6062)
                .containsEntry("longitude", -122.3321);
    }

    @Test
    void shouldReportNoDataWhenAddressIsUnknown() throws Exception {
        // Given
        when(geocodeApi.geocode("Nowhereville", "geo-key")).thenReturn(mockCall);
        when(mockCall.execute()).thenReturn(Response.success(new GeocodeJson(null)));

        // When & Then
        assertThatThrownBy(() -> geocodeClient.fetchLocation("Nowhereville").get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(NoUpstreamDataException.class);
    }

    private GeocodeJson.ResultJson result(String address, double lat, double lng) {
        return new GeocodeJson.ResultJson(address,
                new GeocodeJson.GeometryJson(new GeocodeJson.LatLngJson(lat, lng)));
    }
}
