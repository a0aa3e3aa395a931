package com.example.sheetsync.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sheets known to the application. Operations still address tables by name so
 * that sheets added to the workbook later go through the generic path.
 */
public enum SheetTable {
    USUARIOS("Usuarios"),
    CLIENTES("Clientes"),
    PROYECTOS("Proyectos"),
    ACTIVIDADES("Actividades"),
    ASIGNACIONES("Asignaciones"),
    PERSONAL("Personal"),
    COLABORADORES("Colaboradores"),
    MATERIALES("Materiales"),
    BOM("BOM"),
    SOLICITUD_COMPRA("SolicitudCompra"),
    REGISTRO_HORAS("RegistroHoras"),
    EVIDENCIAS("Evidencias"),
    DOCUMENTOS("Documentos");

    private static final Map<String, SheetTable> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(t -> t.sheetName.toLowerCase(), Function.identity()));

    private final String sheetName;

    SheetTable(String sheetName) {
        this.sheetName = sheetName;
    }

    public String sheetName() {
        return sheetName;
    }

    /**
     * Tables whose cached lists embed or aggregate rows of this table and must
     * be dropped when it changes.
     */
    public Set<SheetTable> relatedTables() {
        switch (this) {
            case PROYECTOS:
                return EnumSet.of(ACTIVIDADES, ASIGNACIONES, BOM, SOLICITUD_COMPRA);
            case ACTIVIDADES:
                return EnumSet.of(PROYECTOS, ASIGNACIONES, REGISTRO_HORAS, EVIDENCIAS);
            case MATERIALES:
                return EnumSet.of(BOM, SOLICITUD_COMPRA);
            case PERSONAL:
                return EnumSet.of(ASIGNACIONES, REGISTRO_HORAS);
            case USUARIOS:
                return EnumSet.of(PROYECTOS, ACTIVIDADES, ASIGNACIONES);
            default:
                return EnumSet.noneOf(SheetTable.class);
        }
    }

    public static Optional<SheetTable> fromName(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(BY_NAME.get(name.toLowerCase()));
    }

    public boolean matches(String name) {
        return sheetName.equalsIgnoreCase(name);
    }
}
