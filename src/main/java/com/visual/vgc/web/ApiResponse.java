package com.visual.vgc.web;

/** Status code and JSON body of one API call. */
public record ApiResponse(int status, String body) {
}
