package com.mindcanvus.adapter.in.web;

/**
 * Body of commands that have nothing to return but a confirmation.
 */
public record StatusResponse(String message) {}
