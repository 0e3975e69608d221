package com.podium.application.service;

import com.podium.domain.account.Address;

/** Executed trade. */
public record PassTrade(Address account, Address subject, Address referrer, PassQuote quote, long supplyAfter) {}
