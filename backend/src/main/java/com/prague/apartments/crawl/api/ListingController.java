package com.prague.apartments.crawl.api;

import com.prague.apartments.crawl.model.Listing;
import com.prague.apartments.crawl.model.ListingFilter;
import com.prague.apartments.crawl.model.ListingStats;
import com.prague.apartments.crawl.model.MessageResponse;
import com.prague.apartments.crawl.service.ListingQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ListingController {
    private final ListingQueryService queryService;

    public ListingController(ListingQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping
    public MessageResponse root() {
        return new MessageResponse("Prague Apartments Crawler API");
    }

    @GetMapping("/apartments")
    public List<Listing> getApartments(
        @RequestParam(name = "skip", required = false) Integer skip,
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "min_price", required = false) Long minPrice,
        @RequestParam(name = "max_price", required = false) Long maxPrice,
        @RequestParam(name = "min_size", required = false) Integer minSize,
        @RequestParam(name = "max_size", required = false) Integer maxSize,
        @RequestParam(name = "has_garage", required = false) Boolean hasGarage,
        @RequestParam(name = "room_layout", required = false) String roomLayout
    ) {
        String layout = roomLayout == null || roomLayout.isBlank() ? null : roomLayout.trim();
        ListingFilter filter = new ListingFilter(minPrice, maxPrice, minSize, maxSize, hasGarage, layout);
        return queryService.getListings(skip, limit, filter);
    }

    @GetMapping("/apartments/new")
    public List<Listing> getNewApartments(@RequestParam(name = "hours", required = false) Integer hours) {
        return queryService.getNewListings(hours);
    }

    @GetMapping("/apartments/{id}")
    public Listing getApartment(@PathVariable("id") long id) {
        return queryService.getListing(id);
    }

    @PostMapping("/crawl/trigger")
    public ResponseEntity<MessageResponse> triggerCrawl() {
        queryService.triggerIngestion();
        return ResponseEntity.accepted().body(new MessageResponse("Crawling triggered"));
    }

    @GetMapping("/stats")
    public ListingStats getStats() {
        return queryService.getStats();
    }
}
