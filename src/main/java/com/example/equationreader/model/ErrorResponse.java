package com.example.equationreader.model;

public record ErrorResponse(String error) {
}
