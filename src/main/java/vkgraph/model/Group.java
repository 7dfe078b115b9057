package vkgraph.model;

public record Group(long id, String name, int membersCount) {
}
