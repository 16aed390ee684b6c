package io.intellixity.tusk.persistence.query;

public enum Clause { AND, OR }
