package com.prague.apartments.crawl.http;

import com.prague.apartments.config.CrawlerProperties;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import static org.assertj.core.api.Assertions.assertThat;

class SrealityEstatesClientTest {

    @Test
    void requestsFirstPageOfApartmentsForRent() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getUpstream().setBaseUrl("https://example.test/api/cs/v2/estates");
        SrealityEstatesClient client = new SrealityEstatesClient(Mockito.mock(UpstreamHttpClient.class), properties);

        assertThat(client.estatesUrl()).isEqualTo(
            "https://example.test/api/cs/v2/estates?category_main_cb=1&category_sub_cb=2&category_type_cb=2&page=1"
        );
    }

    @Test
    void omitsMainCategoryWhenDisabled() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getUpstream().setBaseUrl("https://example.test/estates");
        properties.getUpstream().setCategoryMain(0);
        SrealityEstatesClient client = new SrealityEstatesClient(Mockito.mock(UpstreamHttpClient.class), properties);

        assertThat(client.estatesUrl()).isEqualTo(
            "https://example.test/estates?category_sub_cb=2&category_type_cb=2&page=1"
        );
    }
}
