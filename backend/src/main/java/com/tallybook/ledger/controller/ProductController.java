package com.tallybook.ledger.controller;

import com.tallybook.ledger.config.ImportSettings;
import com.tallybook.ledger.matching.MatchCandidate;
import com.tallybook.ledger.matching.ProductMatcher;
import com.tallybook.ledger.util.ProductNameNormalizer;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/products")
@CrossOrigin(origins = "*")
public class ProductController {

    private final ProductMatcher productMatcher;
    private final ImportSettings settings;

    public ProductController(ProductMatcher productMatcher, ImportSettings settings) {
        this.productMatcher = productMatcher;
        this.settings = settings;
    }

    // Raw name in, catalog candidates out (best first)
    @GetMapping("/match")
    public List<MatchCandidate> match(@RequestParam("name") String name,
                                      @RequestParam(value = "threshold", required = false) Integer threshold,
                                      @RequestParam(value = "limit", required = false) Integer limit) {
        String key = ProductNameNormalizer.normalize(name);
        int t = threshold != null ? Math.max(0, Math.min(100, threshold)) : settings.getMatchThreshold();
        int l = limit != null ? Math.max(1, limit) : settings.getMatchLimit();
        return productMatcher.match(key, t, l);
    }
}
