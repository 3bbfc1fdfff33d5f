package com.z254.lighthouse.beacon.remediation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Playbook repository keyed by playbook identifier.
 */
@Slf4j
@Component
public class PlaybookRegistry {

    private final Map<String, Playbook> playbooks = new ConcurrentHashMap<>();

    public PlaybookRegistry(List<Playbook> playbooks) {
        playbooks.forEach(this::registerPlaybook);
    }

    public Optional<Playbook> getPlaybook(String playbookId) {
        return Optional.ofNullable(playbookId).map(playbooks::get);
    }

    /**
     * Distinct playbooks, aliases collapsed.
     */
    public List<Playbook> listPlaybooks() {
        return new ArrayList<>(playbooks.values().stream().distinct().toList());
    }

    /**
     * Register a playbook under its identifier and aliases, replacing any previous holder.
     */
    public void registerPlaybook(Playbook playbook) {
        playbooks.put(playbook.getId(), playbook);
        playbook.getAliases().forEach(alias -> playbooks.put(alias, playbook));
        log.info("Registered playbook: {} {}", playbook.getId(), playbook.getAliases());
    }
}
