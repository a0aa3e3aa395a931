package com.example.sheetsync.service;

import com.example.sheetsync.model.SheetTable;
import com.example.sheetsync.model.SyncEvent;
import com.example.sheetsync.model.SyncOperation;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory view of who is an admin, who works on which project and who manages it.
 * Loaded from Usuarios, Asignaciones and Proyectos and kept current from sync events,
 * so notification targeting needs no remote call. A reload builds its map aside and
 * swaps it in, so readers never see a half-loaded table.
 */
public class TeamDirectory {

    private static final Logger logger = LoggerFactory.getLogger(TeamDirectory.class);

    private final Set<String> configuredAdmins;
    private final Set<String> adminRoles;
    private volatile Map<String, String> roles = new ConcurrentHashMap<>();
    private volatile Map<String, Assignment> assignments = new ConcurrentHashMap<>();
    private volatile Map<String, String> managers = new ConcurrentHashMap<>();

    public TeamDirectory(Collection<String> configuredAdmins, Collection<String> adminRoles) {
        this.configuredAdmins = Set.copyOf(configuredAdmins);
        this.adminRoles = adminRoles.stream().map(r -> r.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
    }

    public Set<String> adminUsers() {
        Set<String> admins = new LinkedHashSet<>(configuredAdmins);
        roles.forEach((user, role) -> {
            if (adminRoles.contains(role)) admins.add(user);
        });
        return admins;
    }

    public Set<String> projectManagers(String projectId) {
        String manager = projectId == null ? null : managers.get(projectId);
        return manager == null ? Set.of() : Set.of(manager);
    }

    /**
     * Assigned collaborators plus the project manager.
     */
    public Set<String> projectMembers(String projectId) {
        if (projectId == null) return Set.of();
        Set<String> members = assignments.values().stream()
                .filter(a -> projectId.equals(a.getProjectId()))
                .map(Assignment::getMemberId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        members.addAll(projectManagers(projectId));
        return members;
    }

    public synchronized void replaceUsers(List<Map<String, Object>> rows) {
        Map<String, String> loaded = new ConcurrentHashMap<>();
        for (Map<String, Object> row : rows) {
            putUser(loaded, row);
        }
        roles = loaded;
        logger.debug("Team directory loaded {} users", loaded.size());
    }

    public synchronized void replaceAssignments(List<Map<String, Object>> rows) {
        Map<String, Assignment> loaded = new ConcurrentHashMap<>();
        for (Map<String, Object> row : rows) {
            putAssignment(loaded, row);
        }
        assignments = loaded;
        logger.debug("Team directory loaded {} assignments", loaded.size());
    }

    public synchronized void replaceProjects(List<Map<String, Object>> rows) {
        Map<String, String> loaded = new ConcurrentHashMap<>();
        for (Map<String, Object> row : rows) {
            putProject(loaded, row);
        }
        managers = loaded;
        logger.debug("Team directory loaded {} project managers", loaded.size());
    }

    /**
     * Folds a committed write into the directory. Events of other tables are ignored.
     */
    public synchronized void apply(SyncEvent event) {
        SheetTable.fromName(event.getTable()).ifPresent(table -> {
            boolean deleted = event.getOperation() == SyncOperation.DELETE;
            switch (table) {
                case USUARIOS:
                    if (deleted) roles.remove(event.getRecordId());
                    else putUser(roles, withId(event));
                    break;
                case ASIGNACIONES:
                    if (deleted) assignments.remove(event.getRecordId());
                    else putAssignment(assignments, withId(event));
                    break;
                case PROYECTOS:
                    if (deleted) managers.remove(event.getRecordId());
                    else putProject(managers, withId(event));
                    break;
                default:
                    break;
            }
        });
    }

    private static void putUser(Map<String, String> roles, Map<String, Object> row) {
        String id = text(row.get("id"));
        if (id == null) return;
        String role = text(row.get("rol"));
        if (role == null) roles.remove(id);
        else roles.put(id, role.toLowerCase(Locale.ROOT));
    }

    private static void putAssignment(Map<String, Assignment> assignments, Map<String, Object> row) {
        String id = text(row.get("id"));
        String project = text(row.get("proyecto_id"));
        String member = text(row.get("colaborador_id"));
        if (id == null) return;
        if (project == null || member == null) assignments.remove(id);
        else assignments.put(id, new Assignment(project, member));
    }

    private static void putProject(Map<String, String> managers, Map<String, Object> row) {
        String id = text(row.get("id"));
        if (id == null) return;
        String manager = text(row.get("responsable_id"));
        if (manager == null) managers.remove(id);
        else managers.put(id, manager);
    }

    private static Map<String, Object> withId(SyncEvent event) {
        Map<String, Object> row = new HashMap<>();
        if (event.getData() != null) row.putAll(event.getData());
        row.putIfAbsent("id", event.getRecordId());
        return row;
    }

    private static String text(Object value) {
        String s = Objects.toString(value, null);
        return s == null || s.isBlank() ? null : s.trim();
    }

    @Value
    private static class Assignment {
        String projectId;
        String memberId;
    }
}
