package com.wtbmonitor.market.service;

import com.wtbmonitor.config.MonitorProperties;
import com.wtbmonitor.market.model.StoreTarget;
import com.wtbmonitor.market.model.StoreTargetsResponse;
import com.wtbmonitor.market.model.StoreToggleResponse;
import com.wtbmonitor.market.persistence.StoreTargetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

/**
 * Manages the WTB stores handed to the scraper. Targets are addressed by their position in the listing.
 */
@Service
public class StoreTargetService {
    private static final Logger log = LoggerFactory.getLogger(StoreTargetService.class);

    private final StoreTargetRepository repository;
    private final MonitorProperties properties;
    private final Object targetsLock = new Object();

    public StoreTargetService(StoreTargetRepository repository, MonitorProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    public StoreTargetsResponse listTargets() {
        List<StoreTarget> targets = repository.listTargets();
        return new StoreTargetsResponse(targets.size() + " store targets", targets);
    }

    public List<StoreTarget> enabledTargets() {
        return repository.listTargets().stream()
            .filter(StoreTarget::enabled)
            .toList();
    }

    public StoreTargetsResponse addTarget(String name, String url) {
        String cleanName = name == null ? "" : name.trim();
        String cleanUrl = url == null ? "" : url.trim();
        if (cleanName.isEmpty() || cleanUrl.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "Name and URL are required");
        }
        String prefix = properties.getStores().getUrlPrefix();
        if (!cleanUrl.startsWith(prefix)) {
            throw new ResponseStatusException(BAD_REQUEST, "URL must start with " + prefix);
        }
        synchronized (targetsLock) {
            repository.insertTarget(cleanName, cleanUrl);
            log.info("Store target added: {} ({})", cleanName, cleanUrl);
            return new StoreTargetsResponse("Store '" + cleanName + "' added", repository.listTargets());
        }
    }

    public StoreTargetsResponse removeTarget(int index) {
        synchronized (targetsLock) {
            StoreTarget target = targetAt(index);
            repository.deleteTarget(target.id());
            log.info("Store target removed: {}", target.name());
            return new StoreTargetsResponse("Store '" + target.name() + "' removed", repository.listTargets());
        }
    }

    public StoreToggleResponse toggleTarget(int index) {
        synchronized (targetsLock) {
            StoreTarget target = targetAt(index);
            boolean enabled = !target.enabled();
            repository.setEnabled(target.id(), enabled);
            log.info("Store target {} {}", target.name(), enabled ? "enabled" : "disabled");
            return new StoreToggleResponse("Store toggled", enabled);
        }
    }

    private StoreTarget targetAt(int index) {
        List<StoreTarget> targets = repository.listTargets();
        if (index < 0 || index >= targets.size()) {
            throw new ResponseStatusException(NOT_FOUND, "Invalid store index: " + index);
        }
        return targets.get(index);
    }
}
