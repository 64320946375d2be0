package com.wtbmonitor.market.api;

import com.wtbmonitor.market.model.StoreTargetsResponse;
import com.wtbmonitor.market.model.StoreToggleResponse;
import com.wtbmonitor.market.service.StoreTargetService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/stores")
public class StoreTargetController {
    private final StoreTargetService storeTargetService;

    public StoreTargetController(StoreTargetService storeTargetService) {
        this.storeTargetService = storeTargetService;
    }

    @GetMapping
    public StoreTargetsResponse listStores() {
        return storeTargetService.listTargets();
    }

    @PostMapping
    public StoreTargetsResponse addStore(@RequestBody(required = false) StoreTargetRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "Name and URL are required");
        }
        return storeTargetService.addTarget(request.name(), request.url());
    }

    @DeleteMapping("/{index}")
    public StoreTargetsResponse removeStore(@PathVariable("index") int index) {
        return storeTargetService.removeTarget(index);
    }

    @PutMapping("/{index}/toggle")
    public StoreToggleResponse toggleStore(@PathVariable("index") int index) {
        return storeTargetService.toggleTarget(index);
    }
}
