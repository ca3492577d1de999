package com.autotax.unit.localtax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.autotax.domain.enums.LocalRateSource;
import com.autotax.domain.model.LocalTaxRateInfo;
import com.autotax.exception.BusinessException;
import com.autotax.exception.ErrorCode;
import com.autotax.exception.ResourceNotFoundException;
import com.autotax.localtax.LocalTaxRateService;
import com.autotax.localtax.LocalTaxRateTable;
import com.autotax.mapper.JsonHelper;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

/**
 * Unit tests for LocalTaxRateService against the bundled rate table.
 */
class LocalTaxRateServiceTest {

    private static LocalTaxRateService service;

    @BeforeAll
    static void loadTable() throws IOException {
        ClassPathResource resource = new ClassPathResource("tax-data/local-tax-rates.json");
        try (InputStream in = resource.getInputStream()) {
            service = new LocalTaxRateService(JsonHelper.fromJson(in, LocalTaxRateTable.class, "local-tax-rates.json"));
        }
    }

    // ==============================
    // RESOLUTION
    // ==============================

    @Nested
    @DisplayName("Resolution order")
    class Resolution {

        @Test
        @DisplayName("Known ZIP in the requested state resolves exactly")
        void zipExact() {
            LocalTaxRateInfo info = service.lookup("85004", "AZ");

            assertThat(info.getSource()).isEqualTo(LocalRateSource.ZIP_EXACT);
            assertThat(info.getCity()).isEqualTo("Phoenix");
            assertThat(info.getStateTaxRate()).isEqualByComparingTo("0.056");
            assertThat(info.getCombinedRate()).isEqualByComparingTo("0.086");
        }

        @Test
        @DisplayName("ZIP+4 and lowercase prefixed state codes are accepted")
        void zipPlusFour() {
            LocalTaxRateInfo info = service.lookup("60601-1234", "us_il");

            assertThat(info.getZipCode()).isEqualTo("60601");
            assertThat(info.getStateCode()).isEqualTo("IL");
            assertThat(info.getSpecialDistrictRate()).isEqualByComparingTo("0.01");
        }

        @Test
        @DisplayName("Missing state code is taken from the ZIP entry")
        void stateFromZip() {
            LocalTaxRateInfo info = service.lookup("46204", null);

            assertThat(info.getStateCode()).isEqualTo("IN");
            assertThat(info.getSource()).isEqualTo(LocalRateSource.ZIP_EXACT);
        }

        @Test
        @DisplayName("Unknown ZIP in a local-tax state uses the state average")
        void stateAverage() {
            LocalTaxRateInfo info = service.lookup("85999", "AZ");

            assertThat(info.getSource()).isEqualTo(LocalRateSource.STATE_AVERAGE);
            assertThat(info.getCountyRate()).isEqualByComparingTo("0.0277");
            assertThat(info.getCityRate()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Unknown ZIP in a state without local tax uses the state rate only")
        void stateOnly() {
            LocalTaxRateInfo info = service.lookup("27601", "NC");

            assertThat(info.getSource()).isEqualTo(LocalRateSource.STATE_ONLY);
            assertThat(info.getCombinedRate()).isEqualByComparingTo("0.03");
        }

        @Test
        @DisplayName("ZIP from another state falls back to the requested state's rates")
        void zipStateMismatch() {
            LocalTaxRateInfo info = service.lookup("85004", "IL");

            assertThat(info.getStateCode()).isEqualTo("IL");
            assertThat(info.getSource()).isEqualTo(LocalRateSource.STATE_AVERAGE);
            assertThat(info.getCity()).isNull();
        }
    }

    // ==============================
    // ERRORS
    // ==============================

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Malformed ZIP is a validation error")
        void malformedZip() {
            assertThatThrownBy(() -> service.lookup("8500", "AZ"))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.VALIDATION_ERROR);
        }

        @Test
        @DisplayName("State without rate data is not found")
        void unknownState() {
            assertThatThrownBy(() -> service.lookup("73301", "TX"))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessage("No state tax rates for TX")
                    .extracting(e -> ((ResourceNotFoundException) e).getDetails())
                    .isEqualTo(Map.of("stateCode", "TX"));
        }

        @Test
        @DisplayName("Unknown ZIP without a state code is not found")
        void unknownZipWithoutState() {
            assertThatThrownBy(() -> service.lookup("99999", null))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .extracting(e -> ((ResourceNotFoundException) e).getDetails())
                    .isEqualTo(Map.of("zipCode", "99999"));
        }

        @Test
        @DisplayName("hasStateData reflects the table")
        void hasStateData() {
            assertThat(service.hasStateData("oR")).isTrue();
            assertThat(service.hasStateData("TX")).isFalse();
            assertThat(service.hasStateData(null)).isFalse();
        }
    }
}
