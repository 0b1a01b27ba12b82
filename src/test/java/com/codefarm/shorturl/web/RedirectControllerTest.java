package com.codefarm.shorturl.web;

import com.codefarm.shorturl.core.ShortUrlService;
import com.codefarm.shorturl.domain.AccessContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.head;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RedirectController.class)
@Import(ClientInfoExtractor.class)
@DisplayName("RedirectController test")
class RedirectControllerTest {

    private static final String CHROME_ON_ANDROID =
            "Mozilla/5.0 (Linux; Android 14; Pixel 8) AppleWebKit/537.36 Chrome/120.0 Mobile Safari/537.36";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ShortUrlService service;

    @Test
    @DisplayName("a resolvable code redirects with 302 and no shared caching")
    void redirects() throws Exception {
        given(service.resolve(eq("abc123"), any())).willReturn(Optional.of("https://example.com"));

        mockMvc.perform(get("/r/abc123"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "https://example.com"))
                .andExpect(header().string("Cache-Control", "private, max-age=90"))
                .andExpect(header().string("X-Robots-Tag", "noindex"));
    }

    @Test
    @DisplayName("an unresolvable code is a 404")
    void notFound() throws Exception {
        given(service.resolve(eq("nope"), any())).willReturn(Optional.empty());

        mockMvc.perform(get("/r/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("client details come from proxy headers and the user agent")
    void accessContext() throws Exception {
        given(service.resolve(eq("abc123"), any())).willReturn(Optional.of("https://example.com"));

        mockMvc.perform(get("/r/abc123")
                        .header("X-Forwarded-For", "198.51.100.4, 10.0.0.1")
                        .header("User-Agent", CHROME_ON_ANDROID)
                        .header("Referer", "https://news.example.org"))
                .andExpect(status().isFound());

        ArgumentCaptor<AccessContext> captor = ArgumentCaptor.forClass(AccessContext.class);
        then(service).should().resolve(eq("abc123"), captor.capture());
        AccessContext access = captor.getValue();
        assertThat(access.ipAddress()).isEqualTo("198.51.100.4");
        assertThat(access.referrer()).isEqualTo("https://news.example.org");
        assertThat(access.device().mobile()).isTrue();
        assertThat(access.device().operatingSystem()).isEqualTo("Android");
    }

    @Test
    @DisplayName("HEAD checks the link without recording an access")
    void headCheck() throws Exception {
        given(service.lookup("abc123")).willReturn(Optional.of("https://example.com"));

        mockMvc.perform(head("/r/abc123"))
                .andExpect(status().isOk())
                .andExpect(header().string(RedirectController.ORIGINAL_URL_HEADER, "https://example.com"));

        then(service).should(never()).resolve(any(), any());
    }
}
