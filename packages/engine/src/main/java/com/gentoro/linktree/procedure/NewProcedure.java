package com.gentoro.linktree.procedure;

/** Request to add a procedure; fields are raw user input and are trimmed on add. */
public record NewProcedure(String code, String title, String link, String tag) {}
