@NamedInterface("api")
package kr.jemi.zevent.ticket.api;

import org.springframework.modulith.NamedInterface;
