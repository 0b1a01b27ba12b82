package com.codefarm.shorturl.web;

import com.codefarm.shorturl.core.ShortUrlService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/r")
public class RedirectController {

    static final String ORIGINAL_URL_HEADER = "X-Original-URL";

    private final ShortUrlService service;
    private final ClientInfoExtractor clientInfoExtractor;

    public RedirectController(ShortUrlService service, ClientInfoExtractor clientInfoExtractor) {
        this.service = service;
        this.clientInfoExtractor = clientInfoExtractor;
    }

    @GetMapping("/{shortCode}")
    public ResponseEntity<Void> redirect(@PathVariable String shortCode, HttpServletRequest request) {
        return service.resolve(shortCode, clientInfoExtractor.extract(request))
                .map(RedirectController::found)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @RequestMapping(value = "/{shortCode}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> check(@PathVariable String shortCode) {
        return service.lookup(shortCode)
                .map(url -> ResponseEntity.ok().header(ORIGINAL_URL_HEADER, url).<Void>build())
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private static ResponseEntity<Void> found(String originalUrl) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.LOCATION, originalUrl);
        headers.add(HttpHeaders.CACHE_CONTROL, "private, max-age=90");
        headers.add("X-Robots-Tag", "noindex");
        return new ResponseEntity<>(headers, HttpStatus.FOUND);
    }
}
