package com.example.sheetsync.service;

import com.example.sheetsync.model.GatewayResult;
import com.example.sheetsync.model.SheetTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Reloads the {@link TeamDirectory} from the workbook. Goes through the gateway, so a
 * remote outage leaves the last snapshot in place.
 */
@Component
public class DirectoryRefresher {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryRefresher.class);

    private final CrudGateway gateway;
    private final TeamDirectory directory;

    public DirectoryRefresher(CrudGateway gateway, TeamDirectory directory) {
        this.gateway = gateway;
        this.directory = directory;
    }

    @Scheduled(fixedDelayString = "${app.notifications.directory-refresh-ms:300000}", initialDelay = 1000L)
    public void run() {
        refresh().subscribe();
    }

    public Mono<Void> refresh() {
        return Mono.when(
                load(SheetTable.USUARIOS, directory::replaceUsers),
                load(SheetTable.ASIGNACIONES, directory::replaceAssignments),
                load(SheetTable.PROYECTOS, directory::replaceProjects));
    }

    private Mono<Void> load(SheetTable table, Consumer<List<Map<String, Object>>> target) {
        return gateway.list(table.sheetName(), Map.of(), null, false)
                .doOnNext(result -> apply(table, result, target))
                .then();
    }

    private void apply(SheetTable table, GatewayResult<List<Map<String, Object>>> result,
                       Consumer<List<Map<String, Object>>> target) {
        if (!result.isOk()) {
            logger.warn("Team directory refresh of {} failed: {}", table.sheetName(), result.getMessage());
            return;
        }
        target.accept(result.getData());
    }
}
