package eu.virtualparadox.ctxstore.api.model;

public record StoreContextResult(String id, boolean embedded) {
}
