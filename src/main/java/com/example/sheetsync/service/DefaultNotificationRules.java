package com.example.sheetsync.service;

import com.example.sheetsync.model.NotificationEvent;
import com.example.sheetsync.model.NotificationPriority;
import com.example.sheetsync.model.NotificationType;
import com.example.sheetsync.model.SheetTable;
import com.example.sheetsync.model.SyncEvent;
import com.example.sheetsync.model.SyncOperation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Built-in rules of the project workbook. Targets come from the {@link TeamDirectory}.
 */
public final class DefaultNotificationRules {

    static final String CLOSED = "Cerrado";
    static final String COMPLETED = "Completada";

    private DefaultNotificationRules() {
    }

    public static List<NotificationRule> create(TeamDirectory directory, Clock clock) {
        return List.of(
                projectStatusUpdate(directory, clock),
                projectDeadlineApproaching(directory, clock),
                materialStockAlert(directory, clock),
                criticalMaterialShortage(directory, clock),
                activityCompleted(directory, clock),
                assignmentCreated(clock),
                assignmentRemoved(clock));
    }

    static NotificationRule projectStatusUpdate(TeamDirectory directory, Clock clock) {
        return NotificationRule.builder()
                .id("project-status-update")
                .name("Project Status Update")
                .description("Notify team members when project status changes")
                .table(SheetTable.PROYECTOS)
                .operation(SyncOperation.UPDATE)
                .condition(event -> !Objects.equals(text(event.field("estado")), text(event.previousField("estado"))))
                .generator(event -> {
                    String status = text(event.field("estado"));
                    if (status == null) return null;
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("projectId", event.getRecordId());
                    data.put("projectName", event.field("nombre"));
                    data.put("newStatus", status);
                    data.put("previousStatus", event.previousField("estado"));
                    return notification(clock, "project-status-update", NotificationType.PROJECT_UPDATE)
                            .title("Estado de Proyecto Actualizado")
                            .message(String.format("El proyecto \"%s\" cambió de estado a \"%s\"", event.field("nombre"), status))
                            .data(data)
                            .targetUsers(directory.projectMembers(event.getRecordId()))
                            .priority(CLOSED.equals(status) ? NotificationPriority.HIGH : NotificationPriority.MEDIUM)
                            .build();
                })
                .build();
    }

    static NotificationRule projectDeadlineApproaching(TeamDirectory directory, Clock clock) {
        return NotificationRule.builder()
                .id("project-deadline-approaching")
                .name("Project Deadline Approaching")
                .description("Alert when project deadline is within 7 days")
                .table(SheetTable.PROYECTOS)
                .operation(SyncOperation.UPDATE)
                .condition(event -> {
                    Optional<Long> days = daysUntil(event.field("fin_plan"), clock);
                    return days.isPresent() && days.get() > 0 && days.get() <= 7
                            && !CLOSED.equals(text(event.field("estado")));
                })
                .generator(event -> {
                    long days = daysUntil(event.field("fin_plan"), clock).orElse(0L);
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("projectId", event.getRecordId());
                    data.put("projectName", event.field("nombre"));
                    data.put("deadline", event.field("fin_plan"));
                    data.put("daysRemaining", days);
                    return notification(clock, "project-deadline-approaching", NotificationType.PROJECT_UPDATE)
                            .title("Fecha Límite Próxima")
                            .message(String.format("El proyecto \"%s\" vence en %d días", event.field("nombre"), days))
                            .data(data)
                            .targetUsers(directory.projectMembers(event.getRecordId()))
                            .priority(days <= 3 ? NotificationPriority.HIGH : NotificationPriority.MEDIUM)
                            .build();
                })
                .build();
    }

    static NotificationRule materialStockAlert(TeamDirectory directory, Clock clock) {
        return NotificationRule.builder()
                .id("material-stock-alert")
                .name("Material Stock Alert")
                .description("Alert when material stock reaches minimum level")
                .table(SheetTable.MATERIALES)
                .operation(SyncOperation.UPDATE)
                .condition(event -> crossedDown(event, 1.0))
                .generator(event -> notification(clock, "material-stock-alert", NotificationType.STOCK_ALERT)
                        .title("Stock Mínimo Alcanzado")
                        .message(String.format("El material \"%s\" (%s) ha alcanzado el stock mínimo",
                                event.field("descripcion"), event.field("sku")))
                        .data(stockData(event, false))
                        .targetUsers(directory.adminUsers())
                        .priority(NotificationPriority.HIGH)
                        .build())
                .build();
    }

    static NotificationRule criticalMaterialShortage(TeamDirectory directory, Clock clock) {
        return NotificationRule.builder()
                .id("critical-material-shortage")
                .name("Critical Material Shortage")
                .description("Alert when material stock falls to half the minimum level")
                .table(SheetTable.MATERIALES)
                .operation(SyncOperation.UPDATE)
                .condition(event -> crossedDown(event, 0.5))
                .generator(event -> notification(clock, "critical-material-shortage", NotificationType.STOCK_ALERT)
                        .title("Stock Crítico")
                        .message(String.format("URGENTE: El material \"%s\" tiene stock crítico", event.field("descripcion")))
                        .data(stockData(event, true))
                        .targetUsers(directory.adminUsers())
                        .priority(NotificationPriority.CRITICAL)
                        .build())
                .build();
    }

    static NotificationRule activityCompleted(TeamDirectory directory, Clock clock) {
        return NotificationRule.builder()
                .id("activity-completed")
                .name("Activity Completed")
                .description("Notify project manager when activity is completed")
                .table(SheetTable.ACTIVIDADES)
                .operation(SyncOperation.UPDATE)
                .condition(event -> COMPLETED.equals(text(event.field("estado")))
                        && !COMPLETED.equals(text(event.previousField("estado"))))
                .generator(event -> {
                    String projectId = text(event.field("proyecto_id"));
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("activityId", event.getRecordId());
                    data.put("activityTitle", event.field("titulo"));
                    data.put("projectId", projectId);
                    data.put("completedBy", event.getUserId());
                    return notification(clock, "activity-completed", NotificationType.ACTIVITY_COMPLETE)
                            .title("Actividad Completada")
                            .message(String.format("La actividad \"%s\" ha sido completada", event.field("titulo")))
                            .data(data)
                            .targetUsers(directory.projectManagers(projectId))
                            .priority(NotificationPriority.MEDIUM)
                            .build();
                })
                .build();
    }

    static NotificationRule assignmentCreated(Clock clock) {
        return NotificationRule.builder()
                .id("assignment-change")
                .name("Assignment Change")
                .description("Notify users when they are assigned to a project activity")
                .table(SheetTable.ASIGNACIONES)
                .operation(SyncOperation.CREATE)
                .generator(event -> {
                    String member = text(event.field("colaborador_id"));
                    if (member == null) return null;
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("assignmentId", event.getRecordId());
                    data.put("projectId", event.field("proyecto_id"));
                    data.put("activityId", event.field("actividad_id"));
                    data.put("assignedBy", event.getUserId());
                    return notification(clock, "assignment-change", NotificationType.ASSIGNMENT_CHANGE)
                            .title("Nueva Asignación")
                            .message("Has sido asignado a una nueva actividad")
                            .data(data)
                            .targetUser(member)
                            .priority(NotificationPriority.MEDIUM)
                            .build();
                })
                .build();
    }

    static NotificationRule assignmentRemoved(Clock clock) {
        return NotificationRule.builder()
                .id("assignment-removed")
                .name("Assignment Removed")
                .description("Notify users when they are removed from assignments")
                .table(SheetTable.ASIGNACIONES)
                .operation(SyncOperation.DELETE)
                .generator(event -> {
                    String member = text(event.previousField("colaborador_id"));
                    if (member == null) return null;
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("assignmentId", event.getRecordId());
                    data.put("projectId", event.previousField("proyecto_id"));
                    data.put("activityId", event.previousField("actividad_id"));
                    data.put("removedBy", event.getUserId());
                    return notification(clock, "assignment-removed", NotificationType.ASSIGNMENT_CHANGE)
                            .title("Asignación Removida")
                            .message("Has sido removido de una asignación")
                            .data(data)
                            .targetUser(member)
                            .priority(NotificationPriority.LOW)
                            .build();
                })
                .build();
    }

    /**
     * Stock went from above {@code fraction} of the minimum to at or below it.
     */
    private static boolean crossedDown(SyncEvent event, double fraction) {
        double threshold = number(event.field("stock_minimo")) * fraction;
        double current = number(event.field("stock_actual"));
        double previous = number(event.previousField("stock_actual"));
        return current <= threshold && previous > threshold;
    }

    private static Map<String, Object> stockData(SyncEvent event, boolean critical) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("materialId", event.getRecordId());
        data.put("sku", event.field("sku"));
        data.put("descripcion", event.field("descripcion"));
        data.put("stockActual", event.field("stock_actual"));
        data.put("stockMinimo", event.field("stock_minimo"));
        if (critical) data.put("critical", true);
        return data;
    }

    private static NotificationEvent.NotificationEventBuilder notification(Clock clock, String ruleId, NotificationType type) {
        return NotificationEvent.builder()
                .id("notification_" + UUID.randomUUID())
                .ruleId(ruleId)
                .type(type)
                .timestamp(clock.instant());
    }

    /**
     * Whole days until the deadline, rounded up. Date-only values are taken as UTC midnight.
     */
    static Optional<Long> daysUntil(Object deadline, Clock clock) {
        String value = text(deadline);
        if (value == null) return Optional.empty();
        Instant at;
        try {
            if (value.length() <= 10) {
                at = LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            } else if (value.endsWith("Z") || value.matches(".*[+-]\\d{2}:\\d{2}$")) {
                at = OffsetDateTime.parse(value).toInstant();
            } else {
                at = LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            }
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
        long millis = Duration.between(clock.instant(), at).toMillis();
        long day = Duration.ofDays(1).toMillis();
        return Optional.of(Math.floorDiv(millis + day - 1, day));
    }

    private static double number(Object value) {
        if (value instanceof Number) return ((Number) value).doubleValue();
        String text = text(value);
        if (text == null) return 0;
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String text(Object value) {
        String s = Objects.toString(value, null);
        return s == null || s.isBlank() ? null : s;
    }
}
