package com.codefarm.shorturl.web;

import com.codefarm.shorturl.core.BulkCreateResult;
import com.codefarm.shorturl.core.CreateShortUrlCommand;
import com.codefarm.shorturl.core.CreatedShortUrl;
import com.codefarm.shorturl.core.ShortUrlService;
import com.codefarm.shorturl.core.UrlStatistics;
import com.codefarm.shorturl.domain.DisableReason;
import com.codefarm.shorturl.web.dto.AvailabilityResponse;
import com.codefarm.shorturl.web.dto.BulkShortenRequest;
import com.codefarm.shorturl.web.dto.BulkShortenResponse;
import com.codefarm.shorturl.web.dto.DisableRequest;
import com.codefarm.shorturl.web.dto.EventResponse;
import com.codefarm.shorturl.web.dto.ShortenRequest;
import com.codefarm.shorturl.web.dto.ShortenResponse;
import com.codefarm.shorturl.web.dto.UrlPageResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/urls")
public class UrlApiController {

    private final ShortUrlService service;

    public UrlApiController(ShortUrlService service) {
        this.service = service;
    }

    @PostMapping
    public ResponseEntity<ShortenResponse> shorten(@RequestBody ShortenRequest request,
                                                   @RequestHeader(value = "user_uuid", required = false) String userUuid,
                                                   HttpServletRequest httpRequest) {
        CreatedShortUrl created = service.createShortUrl(new CreateShortUrlCommand(
                request.originalUrl(), userUuid, request.customAlias(), request.expiresAt(), request.metadata()));
        String shortUrl = getBaseUrl(httpRequest) + "/r/" + created.shortCode();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new ShortenResponse(created.shortCode(), shortUrl, created.originalUrl(),
                        created.createdAt(), created.expiresAt()));
    }

    @PostMapping("/bulk")
    public ResponseEntity<BulkShortenResponse> shortenAll(@RequestBody BulkShortenRequest request,
                                                          @RequestHeader(value = "user_uuid", required = false) String userUuid,
                                                          HttpServletRequest httpRequest) {
        List<CreateShortUrlCommand> commands = request.urls() == null ? List.of() : request.urls().stream()
                .map(url -> new CreateShortUrlCommand(
                        url.originalUrl(), userUuid, url.customAlias(), url.expiresAt(), url.metadata()))
                .toList();
        String baseUrl = getBaseUrl(httpRequest);

        List<BulkShortenResponse.Item> items = service.createShortUrls(commands).stream()
                .map(result -> toItem(result, commands.get(result.index()), baseUrl))
                .toList();
        long succeeded = items.stream().filter(item -> item.error() == null).count();
        return ResponseEntity.ok(new BulkShortenResponse(items, succeeded, items.size() - succeeded));
    }

    @GetMapping
    public ResponseEntity<UrlPageResponse> listMine(@RequestHeader(value = "user_uuid", required = false) String userUuid,
                                                    @RequestParam(defaultValue = "0") int page,
                                                    @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(UrlPageResponse.from(service.listByOwner(userUuid, page, size)));
    }

    @GetMapping("/{shortCode}")
    public ResponseEntity<UrlStatistics> statistics(@PathVariable String shortCode) {
        return ResponseEntity.ok(service.getStatistics(shortCode));
    }

    @GetMapping("/{shortCode}/events")
    public ResponseEntity<List<EventResponse>> events(@PathVariable String shortCode) {
        return ResponseEntity.ok(service.history(shortCode).stream().map(EventResponse::from).toList());
    }

    @GetMapping("/{alias}/availability")
    public ResponseEntity<AvailabilityResponse> availability(@PathVariable String alias) {
        return ResponseEntity.ok(new AvailabilityResponse(alias, service.isAvailable(alias)));
    }

    @PostMapping("/{shortCode}/disable")
    public ResponseEntity<Void> disable(@PathVariable String shortCode,
                                        @RequestBody(required = false) DisableRequest request) {
        DisableReason reason = (request == null || request.reason() == null)
                ? DisableReason.ADMIN_ACTION
                : request.reason();
        service.disable(shortCode, reason, request == null ? null : request.adminNotes());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{shortCode}")
    public ResponseEntity<Void> delete(@PathVariable String shortCode) {
        service.delete(shortCode);
        return ResponseEntity.noContent().build();
    }

    private static BulkShortenResponse.Item toItem(BulkCreateResult result, CreateShortUrlCommand command,
                                                   String baseUrl) {
        if (!result.succeeded()) {
            return new BulkShortenResponse.Item(result.index(), null, null, command.originalUrl(), result.error());
        }
        CreatedShortUrl created = result.created();
        return new BulkShortenResponse.Item(result.index(), created.shortCode(),
                baseUrl + "/r/" + created.shortCode(), created.originalUrl(), null);
    }

    private static String getBaseUrl(HttpServletRequest request) {
        String scheme = request.getScheme();
        String host = request.getServerName();
        int port = request.getServerPort();
        boolean isDefault = (scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443);
        return scheme + "://" + host + (isDefault ? "" : (":" + port));
    }
}
